package io.abrserver.asset;

import java.io.IOException;
import java.net.URI;

@FunctionalInterface
public interface AssetFetcher {
    byte[] fetch(URI uri) throws IOException;
}
