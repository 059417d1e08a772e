package io.abrserver.asset;

import java.io.IOException;
import java.net.URI;

public final class AssetFetchException extends IOException {
    private final URI uri;
    private final int status;

    public AssetFetchException(URI uri, int status) {
        super("GET " + uri + " returned HTTP " + status);
        this.uri = uri;
        this.status = status;
    }

    public URI uri() {
        return uri;
    }

    public int status() {
        return status;
    }
}
