package io.abrserver.state;

public final class EmptyHistoryException extends IllegalStateException {
    public EmptyHistoryException(String message) {
        super(message);
    }
}
