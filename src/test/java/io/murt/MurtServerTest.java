package io.murt;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.Response;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static io.murt.ClientUtils.call;
import static io.murt.ClientUtils.postJson;
import static io.murt.ClientUtils.request;
import static io.murt.MurtServerBuilder.murtServer;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThrows;

public class MurtServerTest {

    private static final String CONFIG =
        "- name: first <one>\n" +
        "  method: get\n" +
        "  url: http://localhost/one?a=1&b=2\n" +
        "  params:\n" +
        "    q: \"</script><script>alert(1)</script>\"\n" +
        "- name: second\n" +
        "  method: POST\n" +
        "  url: http://localhost/two\n" +
        "  download: true\n";

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T06:07:08Z"), ZoneId.of("UTC"));

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private MurtServer server;

    private MurtServer start() throws Exception {
        Path config = TestConfig.write(folder, CONFIG);
        server = murtServer()
            .withConfigFile(config)
            .withStaticDir(folder.getRoot().toPath().resolve("no-such-dir"))
            .withClock(CLOCK)
            .start();
        return server;
    }

    @Test
    public void theIndexPageListsTheTemplates() throws Exception {
        start();
        assertThat(server.catalog().size(), is(2));
        assertThat(server.catalog().byName("second").map(RequestTemplate::download).orElse(false), is(true));
        try (Response resp = call(request(server.uri()))) {
            assertThat(resp.code(), is(200));
            assertThat(resp.header("Content-Type"), containsString("text/html"));
            String html = resp.body().string();
            assertThat(html, containsString("2 templates loaded"));
            assertThat(html, containsString("first &lt;one&gt;"));
            assertThat(html, containsString("a=1&amp;b=2"));
            assertThat(html, containsString(">Download</button>"));
            assertThat(html, not(containsString("</script><script>alert(1)")));
        }
    }

    @Test
    public void bundledStaticAssetsAreServed() throws Exception {
        start();
        try (Response resp = call(request(server.uri().resolve("/static/app.js")))) {
            assertThat(resp.code(), is(200));
            assertThat(resp.body().string(), containsString("/send-request"));
        }
        try (Response resp = call(request(server.uri().resolve("/static/missing.css")))) {
            assertThat(resp.code(), is(404));
        }
    }

    @Test
    public void staticAssetsComeFromTheStaticDirWhenItExists() throws Exception {
        Path staticDir = folder.newFolder("template").toPath();
        Files.writeString(staticDir.resolve("custom.txt"), "from disk");
        server = murtServer()
            .withConfigFile(TestConfig.write(folder, CONFIG))
            .withStaticDir(staticDir)
            .start();

        try (Response resp = call(request(server.uri().resolve("/static/custom.txt")))) {
            assertThat(resp.code(), is(200));
            assertThat(resp.body().string(), equalTo("from disk"));
        }
    }

    @Test
    public void theConfigFileCanBeDownloaded() throws Exception {
        start();
        try (Response resp = call(request(server.uri().resolve("/download")))) {
            assertThat(resp.code(), is(200));
            assertThat(resp.header("Content-Type"), equalTo("application/octet-stream"));
            assertThat(resp.header("Content-Disposition"), equalTo("attachment; filename=\"requests.yaml\""));
            assertThat(resp.body().string(), equalTo(CONFIG));
        }
    }

    @Test
    public void helloReturnsAFixedJsonString() throws Exception {
        start();
        try (Response resp = call(request(server.uri().resolve("/hello")))) {
            assertThat(resp.code(), is(200));
            assertThat(resp.header("Content-Type"), containsString("application/json"));
            assertThat(resp.body().string(), equalTo("\"hello\""));
        }
    }

    @Test
    public void helloJsonReturnsTheCurrentTime() throws Exception {
        start();
        try (Response resp = call(request(server.uri().resolve("/hello_json")))) {
            assertThat(resp.code(), is(200));
            assertThat(resp.body().string(), equalTo("{\"hello\":\"2024-03-05 06:07:08\"}"));
        }
    }

    @Test
    public void postJsonEchoesTheValues() throws Exception {
        start();
        try (Response resp = call(postJson(server.uri().resolve("/post_json"), "{\"value2\":7,\"value3\":\"seven\"}"))) {
            assertThat(resp.code(), is(200));
            JsonNode body = Json.MAPPER.readTree(resp.body().string());
            assertThat(body.get("hello").asText(), equalTo("2024-03-05 06:07:08"));
            assertThat(body.get("value2").asInt(), is(7));
            assertThat(body.get("value3").asText(), equalTo("seven"));
        }
    }

    @Test
    public void postJsonRejectsValuesOfTheWrongType() throws Exception {
        start();
        try (Response resp = call(postJson(server.uri().resolve("/post_json"), "{\"value2\":\"seven\"}"))) {
            assertThat(resp.code(), is(400));
            assertThat(resp.body().string(), containsString("value2"));
        }
        try (Response resp = call(postJson(server.uri().resolve("/post_json"), "{oops"))) {
            assertThat(resp.code(), is(400));
        }
    }

    @Test
    public void diagnosticEndpointsCanBeUsedAsUpstreams() throws Exception {
        MurtServer upstream = start();
        MurtServer front = murtServer()
            .withConfigFile(TestConfig.write(folder.newFolder("front").toPath(),
                "- {name: echo, method: POST, url: '" + upstream.uri().resolve("/post_json") + "'}\n"))
            .start();
        try (Response resp = call(postJson(front.uri().resolve("/send-request"), "{\"name\":\"echo\",\"params\":{\"value2\":1,\"value3\":\"x\"}}"))) {
            assertThat(resp.code(), is(200));
            assertThat(resp.body().string(), equalTo("{\"hello\":\"2024-03-05 06:07:08\",\"value2\":1,\"value3\":\"x\"}"));
        } finally {
            front.stop();
        }
    }

    @Test
    public void serversWithoutAConfigFileCannotStart() {
        assertThrows(IllegalStateException.class, () -> murtServer().start());
    }

    @Test
    public void serversWithUnreadableConfigCannotStart() {
        assertThrows(ConfigLoadException.class,
            () -> murtServer().withConfigFile(folder.getRoot().toPath().resolve("missing.yaml")).start());
    }

    @After
    public void stopServer() {
        if (server != null) {
            server.stop();
        }
    }
}
