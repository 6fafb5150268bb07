package io.murt;

import org.junit.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

public class ServerSettingsTest {

    @Test
    public void defaultsAreUsedWhenNothingIsSet() {
        ServerSettings settings = ServerSettings.fromProperties(new Properties());
        assertThat(settings.httpPort(), is(8080));
        assertThat(settings.configFile(), equalTo(Paths.get("config", "requests.yaml")));
        assertThat(settings.staticDir(), equalTo(Paths.get("template")));
        assertThat(settings.upstreamTimeoutMillis(), is(30000L));
    }

    @Test
    public void propertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty("murt.port", " 9090 ");
        props.setProperty("murt.config", "/etc/murt/templates.yaml");
        props.setProperty("murt.static", "assets");
        props.setProperty("murt.upstreamTimeoutMillis", "5000");

        ServerSettings settings = ServerSettings.fromProperties(props);

        assertThat(settings.httpPort(), is(9090));
        assertThat(settings.configFile(), equalTo(Paths.get("/etc/murt/templates.yaml")));
        assertThat(settings.staticDir(), equalTo(Paths.get("assets")));
        assertThat(settings.upstreamTimeoutMillis(), is(5000L));
    }

    @Test
    public void invalidNumbersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerSettings.fromProperties(props("murt.port", "eighty")));
        assertThrows(IllegalArgumentException.class, () -> ServerSettings.fromProperties(props("murt.port", "70000")));
        assertThrows(IllegalArgumentException.class, () -> ServerSettings.fromProperties(props("murt.upstreamTimeoutMillis", "0")));
    }

    private static Properties props(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        return props;
    }
}
