package io.murt;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Startup settings, read from system properties.
 * <table>
 *     <caption>Properties</caption>
 *     <tr><th>Property</th><th>Default</th></tr>
 *     <tr><td><code>murt.port</code></td><td>8080</td></tr>
 *     <tr><td><code>murt.config</code></td><td><code>config/requests.yaml</code></td></tr>
 *     <tr><td><code>murt.static</code></td><td><code>template</code></td></tr>
 *     <tr><td><code>murt.upstreamTimeoutMillis</code></td><td>30000</td></tr>
 * </table>
 */
public final class ServerSettings {

    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_CONFIG_FILE = "config/requests.yaml";
    public static final String DEFAULT_STATIC_DIR = "template";
    public static final long DEFAULT_UPSTREAM_TIMEOUT_MILLIS = 30_000;

    private final int httpPort;
    private final Path configFile;
    private final Path staticDir;
    private final long upstreamTimeoutMillis;

    ServerSettings(int httpPort, Path configFile, Path staticDir, long upstreamTimeoutMillis) {
        this.httpPort = httpPort;
        this.configFile = configFile;
        this.staticDir = staticDir;
        this.upstreamTimeoutMillis = upstreamTimeoutMillis;
    }

    /**
     * @return Settings from {@link System#getProperties()}
     */
    public static ServerSettings fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * @param props The properties to read
     * @return Settings with defaults for anything not set
     * @throws IllegalArgumentException if a numeric property is not a valid number
     */
    public static ServerSettings fromProperties(Properties props) {
        int port = (int) number(props, "murt.port", DEFAULT_PORT);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("murt.port must be between 0 and 65535 but was " + port);
        }
        long timeout = number(props, "murt.upstreamTimeoutMillis", DEFAULT_UPSTREAM_TIMEOUT_MILLIS);
        if (timeout <= 0) {
            throw new IllegalArgumentException("murt.upstreamTimeoutMillis must be positive but was " + timeout);
        }
        Path config = Paths.get(props.getProperty("murt.config", DEFAULT_CONFIG_FILE).trim());
        Path staticDir = Paths.get(props.getProperty("murt.static", DEFAULT_STATIC_DIR).trim());
        return new ServerSettings(port, config, staticDir, timeout);
    }

    private static long number(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number but was " + value, e);
        }
    }

    public int httpPort() {
        return httpPort;
    }

    public Path configFile() {
        return configFile;
    }

    /**
     * @return The directory served under <code>/static</code>. If it does not exist, the bundled assets are served instead.
     */
    public Path staticDir() {
        return staticDir;
    }

    public long upstreamTimeoutMillis() {
        return upstreamTimeoutMillis;
    }

    @Override
    public String toString() {
        return "ServerSettings{" +
            "httpPort=" + httpPort +
            ", configFile=" + configFile +
            ", staticDir=" + staticDir +
            ", upstreamTimeoutMillis=" + upstreamTimeoutMillis +
            '}';
    }
}
