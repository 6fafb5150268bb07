package io.murt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.muserver.Method;
import io.muserver.MuServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Fixed endpoints for checking that the server is up: <code>/hello</code>, <code>/hello_json</code> and
 * <code>/post_json</code>. These also make convenient upstreams for templates that point back at this server.
 */
class DiagnosticRoutes {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticRoutes.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    DiagnosticRoutes(Clock clock) {
        this.clock = clock;
    }

    void addTo(MuServerBuilder server) {
        server.addHandler(Method.GET, "/hello",
            (request, response, pathParams) -> Json.write(response, 200, "hello"));

        server.addHandler(Method.GET, "/hello_json", (request, response, pathParams) -> {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.put("hello", now());
            Json.write(response, 200, body);
        });

        server.addHandler(Method.POST, "/post_json", (request, response, pathParams) -> {
            String requestBody = request.readBodyAsString();
            ObjectNode body;
            try {
                body = echo(requestBody);
            } catch (MalformedRequestException e) {
                log.warn("Could not bind /post_json request: {}", e.getMessage());
                Json.writeError(response, 400, e.getMessage());
                return;
            }
            Json.write(response, 200, body);
        });
    }

    ObjectNode echo(String requestBody) throws MalformedRequestException {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(requestBody == null ? "" : requestBody);
        } catch (JsonProcessingException e) {
            throw new MalformedRequestException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedRequestException("Request body must be a JSON object");
        }
        int value2 = 0;
        JsonNode value2Node = root.get("value2");
        if (value2Node != null && !value2Node.isNull()) {
            if (!value2Node.isIntegralNumber() || !value2Node.canConvertToInt()) {
                throw new MalformedRequestException("value2 must be an integer");
            }
            value2 = value2Node.intValue();
        }
        String value3 = "";
        JsonNode value3Node = root.get("value3");
        if (value3Node != null && !value3Node.isNull()) {
            if (!value3Node.isTextual()) {
                throw new MalformedRequestException("value3 must be a string");
            }
            value3 = value3Node.textValue();
        }

        ObjectNode body = Json.MAPPER.createObjectNode();
        body.put("hello", now());
        body.put("value2", value2);
        body.put("value3", value3);
        return body;
    }

    private String now() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }
}
