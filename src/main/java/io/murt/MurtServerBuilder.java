package io.murt;

import io.muserver.ContextHandlerBuilder;
import io.muserver.Method;
import io.muserver.MuServer;
import io.muserver.MuServerBuilder;
import io.muserver.Mutils;
import io.muserver.handlers.ResourceHandlerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static io.muserver.MuServerBuilder.httpServer;

/**
 * A builder for creating and starting a request template server.
 */
public class MurtServerBuilder {

    private static final Logger log = LoggerFactory.getLogger(MurtServerBuilder.class);

    private int httpPort = 0;
    private Path configFile;
    private Path staticDir = Path.of(ServerSettings.DEFAULT_STATIC_DIR);
    private long upstreamTimeoutInMillis = ServerSettings.DEFAULT_UPSTREAM_TIMEOUT_MILLIS;
    private HttpClient httpClient;
    private Clock clock = Clock.systemDefaultZone();
    private final List<InvocationCompleteListener> invocationCompleteListeners = new ArrayList<>();

    /**
     * Applies the port, config file, static directory and timeout from the given settings.
     *
     * @param settings The settings to use
     * @return This builder
     */
    public MurtServerBuilder withSettings(ServerSettings settings) {
        Mutils.notNull("settings", settings);
        return withHttpPort(settings.httpPort())
            .withConfigFile(settings.configFile())
            .withStaticDir(settings.staticDir())
            .withUpstreamTimeout(settings.upstreamTimeoutMillis());
    }

    /**
     * The port to listen on. Defaults to 0, which picks a random free port.
     *
     * @param httpPort The HTTP port
     * @return This builder
     */
    public MurtServerBuilder withHttpPort(int httpPort) {
        this.httpPort = httpPort;
        return this;
    }

    /**
     * Required value. The YAML file that declares the request templates. It is read once when the server starts.
     *
     * @param configFile The path to the config file
     * @return This builder
     */
    public MurtServerBuilder withConfigFile(Path configFile) {
        this.configFile = configFile;
        return this;
    }

    /**
     * The directory served under <code>/static</code>. If the directory does not exist then the assets
     * bundled in the jar are served.
     *
     * @param staticDir The static file directory
     * @return This builder
     */
    public MurtServerBuilder withStaticDir(Path staticDir) {
        Mutils.notNull("staticDir", staticDir);
        this.staticDir = staticDir;
        return this;
    }

    /**
     * Sets the total time allowed for an upstream call, in millis. Defaults to 30 seconds.
     *
     * @param upstreamTimeoutInMillis The allowed time in milliseconds for a request.
     * @return This builder
     */
    public MurtServerBuilder withUpstreamTimeout(long upstreamTimeoutInMillis) {
        this.upstreamTimeoutInMillis = upstreamTimeoutInMillis;
        return this;
    }

    /**
     * Sets the total time allowed for an upstream call. Defaults to 30 seconds.
     *
     * @param upstreamTimeout The allowed time for a request.
     * @param unit            The timeout unit.
     * @return This builder
     */
    public MurtServerBuilder withUpstreamTimeout(long upstreamTimeout, TimeUnit unit) {
        return withUpstreamTimeout(unit.toMillis(upstreamTimeout));
    }

    /**
     * Specifies the JDK HTTP client used to call upstream servers.
     *
     * @param httpClient The HTTP client to use, or null to use a default client.
     * @return This builder
     */
    public MurtServerBuilder withHttpClient(HttpClient httpClient) {
        this.httpClient = httpClient;
        return this;
    }

    /**
     * The clock used for timestamps in the diagnostic endpoints.
     *
     * @param clock The clock
     * @return This builder
     */
    public MurtServerBuilder withClock(Clock clock) {
        Mutils.notNull("clock", clock);
        this.clock = clock;
        return this;
    }

    /**
     * Registers an invocation completion listener.
     *
     * @param listener A listener to be called when an invocation of <code>/send-request</code> is complete
     * @return This builder
     */
    public MurtServerBuilder addInvocationCompleteListener(InvocationCompleteListener listener) {
        Mutils.notNull("listener", listener);
        invocationCompleteListeners.add(listener);
        return this;
    }

    /**
     * Creates a new HTTP Client builder suitable for calling upstream servers.
     *
     * @return An HTTP Client builder
     */
    public static HttpClient.Builder createHttpClient() {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(ServerSettings.DEFAULT_UPSTREAM_TIMEOUT_MILLIS));
    }

    /**
     * Creates and returns a new instance of a server builder.
     *
     * @return A builder
     */
    public static MurtServerBuilder murtServer() {
        return new MurtServerBuilder();
    }

    /**
     * Loads the templates and starts the server.
     *
     * @return The running server
     * @throws ConfigLoadException if the config file cannot be loaded
     * @throws IllegalStateException if the builder is not fully configured
     */
    public MurtServer start() {
        if (configFile == null) {
            throw new IllegalStateException("A config file must be specified");
        }
        if (upstreamTimeoutInMillis <= 0) {
            throw new IllegalStateException("The upstream timeout must be positive but was " + upstreamTimeoutInMillis);
        }

        TemplateCatalog catalog = new TemplateCatalog(new TemplateLoader().load(configFile));

        HttpClient client = httpClient;
        if (client == null) {
            client = createHttpClient().build();
        }
        OutboundRequestBuilder requestBuilder = new OutboundRequestBuilder(Duration.ofMillis(upstreamTimeoutInMillis));
        List<InvocationCompleteListener> listeners = List.copyOf(invocationCompleteListeners);

        MuServerBuilder builder = httpServer()
            .withHttpPort(httpPort)
            .addHandler(Method.GET, "/", new IndexPage(catalog))
            .addHandler(Method.POST, "/send-request", new TemplateProxyHandler(catalog, client, requestBuilder, listeners))
            .addHandler(Method.GET, "/download", new ConfigDownloadHandler(configFile))
            .addHandler(ContextHandlerBuilder.context("static")
                .addHandler(ResourceHandlerBuilder.fileOrClasspath(staticDir.toString(), "/web")));
        new DiagnosticRoutes(clock).addTo(builder);

        MuServer muServer = builder.start();
        log.info("Murt {} started at {} with {} request templates", Murt.artifactVersion(), muServer.uri(), catalog.size());
        return new MurtServer(muServer, catalog);
    }
}
