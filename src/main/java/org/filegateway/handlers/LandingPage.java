package org.filegateway.handlers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.filegateway.utils.GatewayLogger;

/**
 * Serves the browser front end at {@code /}
 */
public class LandingPage {

    static final String BUNDLED_PAGE = "/sftp.html";

    private static final String NOT_FOUND_HTML =
        "<h1>404 - File Manager Frontend Not Found</h1><p>Ensure sftp.html is in the application directory.</p>";

    private final Path pageFile;

    /**
     * @param pageFile page on disk, or null to use the bundled page
     */
    public LandingPage(Path pageFile) {
        this.pageFile = pageFile;
    }

    public OperationResult serve(GatewayRequest request) {
        try {
            String html = load();
            if (html != null) {
                return OperationResult.html(Outcome.OK, html);
            }
            GatewayLogger.error("HTTP", "Frontend file not found: " + (pageFile != null ? pageFile : BUNDLED_PAGE));
        } catch (IOException e) {
            GatewayLogger.error("HTTP", "Failed to read frontend file: " + e.getMessage());
        }
        return OperationResult.html(Outcome.NOT_FOUND, NOT_FOUND_HTML);
    }

    private String load() throws IOException {
        if (pageFile != null && Files.isRegularFile(pageFile)) {
            return Files.readString(pageFile, StandardCharsets.UTF_8);
        }
        try (InputStream in = LandingPage.class.getResourceAsStream(BUNDLED_PAGE)) {
            if (in == null) {
                return null;
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
