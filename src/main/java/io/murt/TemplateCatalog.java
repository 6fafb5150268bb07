package io.murt;

import java.util.List;
import java.util.Optional;

/**
 * The templates loaded at startup. This is an immutable snapshot that is safe to share between request threads.
 */
public final class TemplateCatalog {

    private final List<RequestTemplate> templates;

    public TemplateCatalog(List<RequestTemplate> templates) {
        this.templates = List.copyOf(templates);
    }

    /**
     * @return All templates in config order
     */
    public List<RequestTemplate> all() {
        return templates;
    }

    /**
     * Finds the first template with the given name. Names are case-sensitive.
     *
     * @param name The name to look for
     * @return The first matching template, or empty if there is none
     */
    public Optional<RequestTemplate> byName(String name) {
        for (RequestTemplate template : templates) {
            if (template.name().equals(name)) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }

    /**
     * @param index The zero-based position in the config
     * @return The template at that position, or empty if out of range
     */
    public Optional<RequestTemplate> byIndex(int index) {
        if (index < 0 || index >= templates.size()) {
            return Optional.empty();
        }
        return Optional.of(templates.get(index));
    }

    /**
     * Finds the template an invocation refers to
     *
     * @param invocation The invocation
     * @return The template
     * @throws TemplateNotFoundException if there is no matching template
     */
    public RequestTemplate find(Invocation invocation) throws TemplateNotFoundException {
        if (invocation.name() != null) {
            return byName(invocation.name())
                .orElseThrow(() -> new TemplateNotFoundException("No request template named " + invocation.name()));
        }
        int id = invocation.id();
        return byIndex(id)
            .orElseThrow(() -> new TemplateNotFoundException("No request template with id " + id + "; there are " + templates.size() + " templates"));
    }

    public int size() {
        return templates.size();
    }
}
