package io.murt;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Creates the request sent to an upstream server for a template.
 * <p>GET requests with parameters have them merged into the query string. All other requests send the
 * body unchanged. Every request is sent with <code>Content-Type: application/json</code>.</p>
 */
public class OutboundRequestBuilder {

    static final String CONTENT_TYPE = "application/json";

    private final Duration timeout;

    /**
     * @param timeout The maximum time to wait for the upstream response, or null for no limit
     */
    public OutboundRequestBuilder(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Builds an outbound request
     *
     * @param method      The HTTP method, in any case
     * @param url         The target URL
     * @param body        The request body, or null for an empty body. Ignored for GET requests that have query params.
     * @param queryParams Parameters to add to the query string of GET requests, or null
     * @return A request ready to send
     * @throws InvalidOutboundRequestException if the URL or method is not valid
     * @throws InvalidParameterException if a query parameter value cannot be written as text
     */
    public HttpRequest build(String method, String url, byte[] body, Map<String, ?> queryParams) throws InvalidOutboundRequestException, InvalidParameterException {
        String upperMethod = method == null ? "" : method.trim().toUpperCase(Locale.ROOT);
        URI target = parseTarget(url);

        HttpRequest.BodyPublisher bodyPublisher;
        if ("GET".equals(upperMethod) && queryParams != null && !queryParams.isEmpty()) {
            target = withQueryParams(target, queryParams);
            bodyPublisher = HttpRequest.BodyPublishers.noBody();
        } else if (body == null || body.length == 0) {
            bodyPublisher = HttpRequest.BodyPublishers.noBody();
        } else {
            bodyPublisher = HttpRequest.BodyPublishers.ofByteArray(body);
        }

        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(target)
                .method(upperMethod, bodyPublisher)
                .header("Content-Type", CONTENT_TYPE);
            if (timeout != null) {
                builder.timeout(timeout);
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new InvalidOutboundRequestException("Cannot create " + upperMethod + " request to " + url + ": " + e.getMessage(), e);
        }
    }

    private static URI parseTarget(String url) throws InvalidOutboundRequestException {
        URI uri;
        try {
            uri = new URI(url == null ? "" : url.trim());
        } catch (Exception e) {
            throw new InvalidOutboundRequestException("Invalid target URL " + url + ": " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || uri.getRawAuthority() == null) {
            throw new InvalidOutboundRequestException("Invalid target URL " + url + ": an absolute http or https URL is required", null);
        }
        return uri;
    }

    /**
     * Merges parameters into the query string of a URI. Existing parameters with the same name are
     * replaced; other existing parameters are kept as they are.
     *
     * @param uri    The URI to add to
     * @param params The parameters to set
     * @return A new URI with the same scheme, authority, path and fragment
     * @throws InvalidParameterException if a value is not a string or integer
     */
    static URI withQueryParams(URI uri, Map<String, ?> params) throws InvalidParameterException {
        List<String> pairs = new ArrayList<>();
        String rawQuery = uri.getRawQuery();
        if (rawQuery != null && !rawQuery.isEmpty()) {
            for (String pair : rawQuery.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String rawName = eq == -1 ? pair : pair.substring(0, eq);
                if (!params.containsKey(URLDecoder.decode(rawName, UTF_8))) {
                    pairs.add(pair);
                }
            }
        }
        for (Map.Entry<String, ?> param : params.entrySet()) {
            String value = ParamValue.of(param.getValue()).toQueryText(param.getKey());
            pairs.add(URLEncoder.encode(param.getKey(), UTF_8) + "=" + URLEncoder.encode(value, UTF_8));
        }

        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getRawAuthority());
        if (uri.getRawPath() != null) {
            sb.append(uri.getRawPath());
        }
        sb.append('?').append(String.join("&", pairs));
        if (uri.getRawFragment() != null) {
            sb.append('#').append(uri.getRawFragment());
        }
        return URI.create(sb.toString());
    }
}
