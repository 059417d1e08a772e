package io.abrserver.state;

import io.abrserver.model.StatePath;

public final class SchemaValidationException extends RuntimeException {
    private final StatePath path;
    private final String detail;

    public SchemaValidationException(StatePath path, String detail) {
        super("Schema validation failed - " + path + ": " + detail);
        this.path = path;
        this.detail = detail;
    }

    public StatePath path() {
        return path;
    }

    public String detail() {
        return detail;
    }
}
