package io.murt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.muserver.MuResponse;

import java.io.IOException;
import java.io.OutputStream;

/**
 * The shared JSON mapper and helpers for writing JSON responses.
 */
final class Json {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private Json() {
    }

    /**
     * Writes a value as the full response body
     */
    static void write(MuResponse response, int status, Object value) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(value);
        response.status(status);
        response.contentType("application/json");
        response.headers().set("Content-Length", bytes.length);
        try (OutputStream out = response.outputStream()) {
            out.write(bytes);
        }
    }

    /**
     * Writes an <code>{"error": "message"}</code> body
     */
    static void writeError(MuResponse response, int status, String message) throws IOException {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", message);
        write(response, status, error);
    }
}
