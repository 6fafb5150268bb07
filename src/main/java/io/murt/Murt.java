package io.murt;

import java.io.InputStream;
import java.util.Properties;

/**
 * Some utilities for the request template proxy. If you want to start a server, use {@link MurtServerBuilder#murtServer()}
 */
public class Murt {

    private static final String version;
    static {
        String v;
        try {
            Properties props = new Properties();
            InputStream in = Murt.class.getResourceAsStream("/META-INF/maven/io.murt/murt/pom.properties");
            if (in == null) {
                v = "0.x";
            } else {
                try {
                    props.load(in);
                } finally {
                    in.close();
                }
                v = props.getProperty("version");
            }
        } catch (Exception ex) {
            v = "0.x";
        }
        version = v;
    }

    /**
     * @return Returns the current version of Murt, or 0.x if unknown
     */
    public static String artifactVersion() {
        return version;
    }

    /**
     * <p>Describes an exception and each of its causes, for example
     * <code>HttpConnectTimeoutException: HTTP connect timed out; ConnectException: Connection refused</code></p>
     * <p>Transport exceptions from the JDK HTTP client frequently have no message, so the simple class
     * name is always included.</p>
     * @param throwable The exception to describe
     * @return A single line description of the exception chain
     */
    public static String describe(Throwable throwable) {
        StringBuilder sb = new StringBuilder();
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth < 10) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(current.getClass().getSimpleName());
            String message = current.getMessage();
            if (message != null && !message.isEmpty()) {
                sb.append(": ").append(message);
            }
            current = current.getCause() == current ? null : current.getCause();
            depth++;
        }
        return sb.toString();
    }
}
