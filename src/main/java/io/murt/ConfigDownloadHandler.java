package io.murt;

import io.muserver.MuRequest;
import io.muserver.MuResponse;
import io.muserver.RouteHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serves the raw template configuration file as an attachment at <code>/download</code>.
 */
public class ConfigDownloadHandler implements RouteHandler {
    private static final Logger log = LoggerFactory.getLogger(ConfigDownloadHandler.class);

    private final Path configFile;

    ConfigDownloadHandler(Path configFile) {
        this.configFile = configFile;
    }

    @Override
    public void handle(MuRequest request, MuResponse response, Map<String, String> pathParams) throws Exception {
        if (!Files.isRegularFile(configFile)) {
            log.warn("Config file {} requested for download but it no longer exists", configFile);
            Json.writeError(response, 404, "The configuration file is not available");
            return;
        }
        String filename = configFile.getFileName().toString().replace("\"", "");
        response.contentType("application/octet-stream");
        response.headers().set("Content-Disposition", "attachment; filename=\"" + filename + "\"");
        response.headers().set("Content-Length", Files.size(configFile));
        try (OutputStream out = response.outputStream()) {
            Files.copy(configFile, out);
        }
    }
}
