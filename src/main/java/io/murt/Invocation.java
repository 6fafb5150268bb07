package io.murt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request from a caller to execute a template, addressed either by name or by its position in the config.
 */
public final class Invocation {

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS = new TypeReference<>() {};

    private final String name;
    private final Integer id;
    private final Map<String, Object> params;

    private Invocation(String name, Integer id, Map<String, Object> params) {
        this.name = name;
        this.id = id;
        this.params = params;
    }

    /**
     * @param name   The template name
     * @param params The runtime parameters
     * @return An invocation addressed by name
     */
    public static Invocation byName(String name, Map<String, Object> params) {
        return new Invocation(name, null, Collections.unmodifiableMap(new LinkedHashMap<>(params)));
    }

    /**
     * @param id     The zero-based template index
     * @param params The runtime parameters
     * @return An invocation addressed by index
     */
    public static Invocation byId(int id, Map<String, Object> params) {
        return new Invocation(null, id, Collections.unmodifiableMap(new LinkedHashMap<>(params)));
    }

    /**
     * Parses a JSON body such as <code>{"name": "echo", "params": {"x": "1"}}</code> or
     * <code>{"id": 0, "params": {}}</code>
     *
     * @param json The request body
     * @return The invocation
     * @throws MalformedRequestException if the body is not valid JSON or does not have exactly one of name or id
     */
    public static Invocation parse(String json) throws MalformedRequestException {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new MalformedRequestException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedRequestException("Request body must be a JSON object with a name or id and params");
        }

        JsonNode nameNode = root.get("name");
        JsonNode idNode = root.get("id");
        boolean hasName = nameNode != null && !nameNode.isNull();
        boolean hasId = idNode != null && !idNode.isNull();
        if (hasName == hasId) {
            throw new MalformedRequestException("Exactly one of name or id must be specified");
        }

        Map<String, Object> params = parseParams(root.get("params"));
        if (hasName) {
            if (!nameNode.isTextual()) {
                throw new MalformedRequestException("name must be a string");
            }
            return byName(nameNode.textValue(), params);
        }
        return byId(parseId(idNode), params);
    }

    private static int parseId(JsonNode idNode) throws MalformedRequestException {
        if (idNode.isIntegralNumber() && idNode.canConvertToInt()) {
            return idNode.intValue();
        }
        if (idNode.isTextual()) {
            try {
                return Integer.parseInt(idNode.textValue().trim());
            } catch (NumberFormatException e) {
                throw new MalformedRequestException("id must be an integer but was " + idNode.textValue(), e);
            }
        }
        throw new MalformedRequestException("id must be an integer");
    }

    private static Map<String, Object> parseParams(JsonNode paramsNode) throws MalformedRequestException {
        if (paramsNode == null || paramsNode.isNull()) {
            return Collections.emptyMap();
        }
        if (!paramsNode.isObject()) {
            throw new MalformedRequestException("params must be a JSON object");
        }
        try {
            return Json.MAPPER.readerFor(PARAMS).readValue(paramsNode);
        } catch (IOException e) {
            throw new MalformedRequestException("params could not be read: " + e.getMessage(), e);
        }
    }

    /**
     * @return The template name, or null if this invocation is addressed by id
     */
    public String name() {
        return name;
    }

    /**
     * @return The template index, or null if this invocation is addressed by name
     */
    public Integer id() {
        return id;
    }

    /**
     * @return The runtime parameters in the order the caller sent them. Never null.
     */
    public Map<String, Object> params() {
        return params;
    }

    @Override
    public String toString() {
        return name != null ? "Invocation{name='" + name + "'}" : "Invocation{id=" + id + "}";
    }
}
