package io.murt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the server using {@link ServerSettings#fromSystemProperties()}, for example:
 * <pre>java -Dmurt.port=8080 -Dmurt.config=config/requests.yaml -jar murt.jar</pre>
 * The process exits with status 1 if the config cannot be loaded or the port cannot be bound.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        MurtServer server;
        try {
            ServerSettings settings = ServerSettings.fromSystemProperties();
            log.info("Starting with {}", settings);
            server = MurtServerBuilder.murtServer()
                .withSettings(settings)
                .addInvocationCompleteListener(new Slf4jInvocationLogger())
                .start();
        } catch (Exception e) {
            log.error("Could not start server", e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "murt-shutdown"));
    }
}
