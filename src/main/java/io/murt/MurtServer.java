package io.murt;

import io.muserver.MuServer;

import java.net.URI;

/**
 * A running request template server. Create one with {@link MurtServerBuilder#murtServer()}.
 */
public class MurtServer {

    private final MuServer muServer;
    private final TemplateCatalog catalog;

    MurtServer(MuServer muServer, TemplateCatalog catalog) {
        this.muServer = muServer;
        this.catalog = catalog;
    }

    /**
     * @return The base URI of the server, such as <code>http://localhost:8080</code>
     */
    public URI uri() {
        return muServer.uri();
    }

    /**
     * @return The templates this server was started with
     */
    public TemplateCatalog catalog() {
        return catalog;
    }

    /**
     * Stops the server
     */
    public void stop() {
        muServer.stop();
    }
}
