package io.murt;

import io.muserver.HeaderNames;
import io.muserver.MuRequest;
import io.muserver.MuResponse;
import io.muserver.RouteHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Handles <code>POST /send-request</code>: finds the template the caller names, sends the outbound request
 * and relays the upstream response.
 */
public class TemplateProxyHandler implements RouteHandler {
    private static final Logger log = LoggerFactory.getLogger(TemplateProxyHandler.class);

    /**
     * An unmodifiable set of the Hop By Hop headers. All are in lowercase.
     */
    public static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
        "keep-alive", "transfer-encoding", "te", "connection", "trailer", "upgrade",
        "proxy-authorization", "proxy-authenticate");

    private static final Set<String> HTTP_2_PSEUDO_HEADERS = Set.of(
        ":method", ":path", ":authority", ":scheme", ":status"
    );

    private final AtomicLong counter = new AtomicLong();
    private final TemplateCatalog catalog;
    private final HttpClient httpClient;
    private final OutboundRequestBuilder requestBuilder;
    private final List<InvocationCompleteListener> completeListeners;

    TemplateProxyHandler(TemplateCatalog catalog, HttpClient httpClient, OutboundRequestBuilder requestBuilder,
                         List<InvocationCompleteListener> completeListeners) {
        this.catalog = catalog;
        this.httpClient = httpClient;
        this.requestBuilder = requestBuilder;
        this.completeListeners = completeListeners;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void handle(MuRequest clientRequest, MuResponse clientResponse, Map<String, String> pathParams) throws Exception {
        final long start = System.currentTimeMillis();
        final long id = counter.incrementAndGet();
        String templateName = null;
        URI target = null;
        try {
            Invocation invocation = Invocation.parse(readBody(clientRequest));
            RequestTemplate template = catalog.find(invocation);
            templateName = template.name();

            byte[] body = Json.MAPPER.writeValueAsBytes(invocation.params());
            HttpRequest targetRequest = requestBuilder.build(template.method(), template.url(), body, invocation.params());
            target = targetRequest.uri();
            if (log.isDebugEnabled()) {
                log.debug("[{}] Invoking template {} with {} {}", id, templateName, targetRequest.method(), target);
            }

            HttpResponse<InputStream> targetResponse = send(targetRequest);
            relay(targetResponse, clientResponse);
        } catch (InvocationException e) {
            log.info("[{}] Invocation failed with {}: {}", id, e.status(), e.getMessage());
            Json.writeError(clientResponse, e.status(), e.getMessage());
        } catch (Exception e) {
            log.error("[" + id + "] Unexpected error while invoking template " + templateName, e);
            if (!clientResponse.hasStartedSendingData()) {
                Json.writeError(clientResponse, 500, "Internal error: " + Murt.describe(e));
            }
        } finally {
            long duration = System.currentTimeMillis() - start;
            for (InvocationCompleteListener listener : completeListeners) {
                try {
                    listener.onComplete(clientRequest, clientResponse, templateName, target, duration);
                } catch (Exception e) {
                    log.warn("invocationCompleteListener error", e);
                }
            }
        }
    }

    private static String readBody(MuRequest clientRequest) throws MalformedRequestException {
        try {
            return clientRequest.readBodyAsString();
        } catch (IOException e) {
            throw new MalformedRequestException("Could not read request body: " + e.getMessage(), e);
        }
    }

    private HttpResponse<InputStream> send(HttpRequest targetRequest) throws UpstreamTransportException {
        try {
            return httpClient.send(targetRequest, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new UpstreamTransportException("Error calling " + targetRequest.method() + " " + targetRequest.uri() + ": " + Murt.describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamTransportException("Interrupted while calling " + targetRequest.uri(), e);
        }
    }

    private static void relay(HttpResponse<InputStream> targetResponse, MuResponse clientResponse) throws UpstreamBodyReadException, IOException {
        byte[] body;
        try (InputStream in = targetResponse.body()) {
            body = in.readAllBytes();
        } catch (IOException e) {
            throw new UpstreamBodyReadException("Error reading response body from " + targetResponse.uri() + ": " + Murt.describe(e), e);
        }

        clientResponse.status(targetResponse.statusCode());
        clientResponse.headers().remove(HeaderNames.DATE); // so that the target's date can be used
        for (Map.Entry<String, List<String>> headerEntry : targetResponse.headers().map().entrySet()) {
            String header = headerEntry.getKey();
            String lowerName = header.toLowerCase();
            if (HOP_BY_HOP_HEADERS.contains(lowerName) || HTTP_2_PSEUDO_HEADERS.contains(lowerName)) {
                continue;
            }
            for (String value : headerEntry.getValue()) {
                clientResponse.headers().add(header, value);
            }
        }
        int status = targetResponse.statusCode();
        if (status != 204 && status != 304) {
            // the upstream value is wrong for HEAD requests, so always use the length actually read
            clientResponse.headers().set(HeaderNames.CONTENT_LENGTH, body.length);
        }

        try (OutputStream out = clientResponse.outputStream()) {
            out.write(body);
        }
    }
}
