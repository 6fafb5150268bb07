package io.murt;

import org.junit.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;

public class IndexPageTest {

    @Test
    public void markupAndPlaceholderTextInTemplatesIsEscapedNotEvaluated() {
        List<RequestTemplate> templates = List.of(
            new RequestTemplate("<b>x</b>{{ version }}{% for t in templates %}", "GET", "http://localhost/a?b=<i>", false,
                Map.of("q", "</textarea><script>alert(1)</script>")));
        String html = IndexPage.render(templates);

        assertThat(html, not(containsString("<b>x</b>")));
        assertThat(html, containsString("&lt;b&gt;x&lt;"));
        assertThat(html, containsString("{{ version }}{% for t in templates %}"));
        assertThat(html, not(containsString("<i>")));
        assertThat(html, not(containsString("</textarea><script>")));
    }

    @Test
    public void theCountAndVersionAreShown() {
        List<RequestTemplate> templates = List.of(
            new RequestTemplate("a", "get", "http://localhost/a", false, null),
            new RequestTemplate("b", "post", "http://localhost/b", true, null));
        String html = IndexPage.render(templates);

        assertThat(html, containsString("2 templates loaded"));
        assertThat(html, containsString("murt " + Murt.artifactVersion()));
    }

    @Test
    public void eachTemplateGetsARowWithItsIndex() {
        List<RequestTemplate> templates = List.of(
            new RequestTemplate("a", "get", "http://localhost/a", false, null),
            new RequestTemplate("b", "post", "http://localhost/b", true, null));
        String html = IndexPage.render(templates);

        assertThat(html, containsString("<tr data-id=\"0\" data-name=\"a\" data-download=\"false\">"));
        assertThat(html, containsString("<tr data-id=\"1\" data-name=\"b\" data-download=\"true\">"));
        assertThat(html, containsString("<td class=\"method\">POST</td>"));
        assertThat(html, containsString(">Download</button>"));
        assertThat(html, containsString(">Send</button>"));
    }

    @Test
    public void methodsAreUpperCasedTheSameWayInEveryLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            String html = IndexPage.render(List.of(new RequestTemplate("opts", "options", "http://localhost/", false, null)));
            assertThat(html, containsString("<td class=\"method\">OPTIONS</td>"));
        } finally {
            Locale.setDefault(original);
        }
    }
}
