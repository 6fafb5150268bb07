package io.murt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mitchellbosecke.pebble.PebbleEngine;
import com.mitchellbosecke.pebble.error.PebbleException;
import com.mitchellbosecke.pebble.loader.ClasspathLoader;
import com.mitchellbosecke.pebble.template.PebbleTemplate;
import io.muserver.MuRequest;
import io.muserver.MuResponse;
import io.muserver.RouteHandler;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The HTML page at <code>/</code> that lists the templates and lets users invoke them.
 * <p>The page is the Pebble template <code>web/index.html</code> on the classpath, rendered with HTML
 * autoescaping. It is rendered once because the templates never change.</p>
 */
public class IndexPage implements RouteHandler {

    static final String PAGE_TEMPLATE = "index.html";

    private static final PebbleEngine engine = createEngine();

    private final String html;

    IndexPage(TemplateCatalog catalog) {
        this.html = render(catalog.all());
    }

    @Override
    public void handle(MuRequest request, MuResponse response, Map<String, String> pathParams) {
        response.contentType("text/html;charset=utf-8");
        response.write(html);
    }

    /**
     * @param templates The templates to list
     * @return The full HTML page
     */
    static String render(List<RequestTemplate> templates) {
        List<Map<String, Object>> rows = new ArrayList<>(templates.size());
        for (int i = 0; i < templates.size(); i++) {
            RequestTemplate template = templates.get(i);
            Map<String, Object> row = new HashMap<>();
            row.put("id", i);
            row.put("name", template.name());
            row.put("method", template.method().toUpperCase(Locale.ROOT));
            row.put("url", template.url());
            row.put("params", prettyJson(template.params()));
            row.put("download", template.download());
            rows.add(row);
        }
        Map<String, Object> context = new HashMap<>();
        context.put("templates", rows);
        context.put("version", Murt.artifactVersion());

        try {
            PebbleTemplate page = engine.getTemplate(PAGE_TEMPLATE);
            try (Writer writer = new StringWriter()) {
                page.evaluate(writer, context);
                return writer.toString();
            }
        } catch (PebbleException | IOException e) {
            throw new IllegalStateException("Could not render " + PAGE_TEMPLATE, e);
        }
    }

    private static String prettyJson(Object value) {
        try {
            return Json.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render template params as JSON", e);
        }
    }

    private static PebbleEngine createEngine() {
        ClasspathLoader loader = new ClasspathLoader();
        loader.setPrefix("web");
        return new PebbleEngine.Builder()
            .loader(loader)
            .autoEscaping(true)
            .defaultEscapingStrategy("html")
            .cacheActive(true)
            .build();
    }
}
