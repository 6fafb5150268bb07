package io.murt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named, preconfigured description of an outbound HTTP call, as declared in the configuration file.
 * <p>Instances are immutable.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RequestTemplate {

    private final String name;
    private final String method;
    private final String url;
    private final boolean download;
    private final Map<String, Object> params;

    /**
     * Creates a template
     *
     * @param name     The name callers use to invoke this template
     * @param method   The HTTP method, in any case
     * @param url      The target URL
     * @param download <code>true</code> if the UI should offer the response as a file download
     * @param params   Default parameter values shown to users, or null for none
     */
    @JsonCreator
    public RequestTemplate(@JsonProperty(value = "name", required = true) String name,
                           @JsonProperty(value = "method", required = true) String method,
                           @JsonProperty(value = "url", required = true) String url,
                           @JsonProperty("download") boolean download,
                           @JsonProperty("params") Map<String, Object> params) {
        this.name = Objects.requireNonNull(name, "name");
        this.method = Objects.requireNonNull(method, "method");
        this.url = Objects.requireNonNull(url, "url");
        this.download = download;
        this.params = params == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * @return The name of the template. Names should be unique but this is not enforced.
     */
    @JsonProperty("name")
    public String name() {
        return name;
    }

    /**
     * @return The HTTP method as written in the config, for example <code>get</code> or <code>POST</code>
     */
    @JsonProperty("method")
    public String method() {
        return method;
    }

    /**
     * @return The target URL
     */
    @JsonProperty("url")
    public String url() {
        return url;
    }

    /**
     * @return <code>true</code> if the web UI should save the response as a file
     */
    @JsonProperty("download")
    public boolean download() {
        return download;
    }

    /**
     * @return The default parameters, in the order they were declared. Never null.
     */
    @JsonProperty("params")
    public Map<String, Object> params() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestTemplate that = (RequestTemplate) o;
        return download == that.download && name.equals(that.name) && method.equals(that.method)
            && url.equals(that.url) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, method, url, download, params);
    }

    @Override
    public String toString() {
        return "RequestTemplate{" +
            "name='" + name + '\'' +
            ", method='" + method + '\'' +
            ", url='" + url + '\'' +
            '}';
    }
}
