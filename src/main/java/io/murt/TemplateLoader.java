package io.murt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads request templates from a YAML file.
 * <p>The file is a sequence of mappings with <code>name</code>, <code>method</code>, <code>url</code> and optional
 * <code>params</code> and <code>download</code> keys.</p>
 */
public final class TemplateLoader {
    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    private static final TypeReference<List<RequestTemplate>> TEMPLATE_LIST = new TypeReference<>() {};

    private final ObjectMapper yamlMapper;

    public TemplateLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads all templates from the given file.
     * <p>Templates that share a name with an earlier template are logged as a warning and kept.</p>
     *
     * @param path The YAML file to read
     * @return An unmodifiable list of templates in the order they appear in the file
     * @throws ConfigLoadException if the file cannot be read or is not a list of templates
     */
    public List<RequestTemplate> load(Path path) {
        Objects.requireNonNull(path, "path");
        String yaml;
        try {
            yaml = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigLoadException("Could not read template config " + path, e);
        }
        List<RequestTemplate> templates = parse(yaml, path.toString());
        log.info("Loaded {} request templates from {}", templates.size(), path);
        return templates;
    }

    List<RequestTemplate> parse(String yaml, String source) {
        List<RequestTemplate> templates;
        try {
            JsonNode root = yamlMapper.readTree(yaml);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return List.of();
            }
            if (!root.isArray()) {
                throw new ConfigLoadException("Invalid template config in " + source + ": expected a list of templates but got " + root.getNodeType(), null);
            }
            templates = yamlMapper.readerFor(TEMPLATE_LIST).readValue(root);
        } catch (IOException e) {
            String detail = e instanceof JsonProcessingException ? ((JsonProcessingException) e).getOriginalMessage() : e.getMessage();
            throw new ConfigLoadException("Invalid template config in " + source + ": " + detail, e);
        }
        if (templates.contains(null)) {
            throw new ConfigLoadException("Invalid template config in " + source + ": empty template entry", null);
        }
        warnOnDuplicateNames(templates);
        return List.copyOf(templates);
    }

    private static void warnOnDuplicateNames(List<RequestTemplate> templates) {
        Set<String> seen = new HashSet<>();
        for (RequestTemplate template : templates) {
            if (!seen.add(template.name())) {
                log.warn("Duplicate request template name: {}", template.name());
            }
        }
    }
}
