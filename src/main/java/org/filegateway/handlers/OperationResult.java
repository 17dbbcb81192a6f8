package org.filegateway.handlers;

import java.nio.file.Path;

import org.json.JSONObject;

/**
 * What a route handler produced: a JSON body, a file to stream, or an
 * HTML page.
 */
public final class OperationResult {

    private final Outcome outcome;
    private final JSONObject json;
    private final Path file;
    private final String html;

    private OperationResult(Outcome outcome, JSONObject json, Path file, String html) {
        this.outcome = outcome;
        this.json = json;
        this.file = file;
        this.html = html;
    }

    /**
     * {@code {"success": true}}; add fields with {@link #with}
     */
    public static OperationResult success() {
        JSONObject json = new JSONObject();
        json.put("success", true);
        return new OperationResult(Outcome.OK, json, null, null);
    }

    public static OperationResult success(String message) {
        return success().with("message", message);
    }

    /**
     * {@code {"success": false, "message": ...}}
     */
    public static OperationResult failure(Outcome outcome, String message) {
        JSONObject json = new JSONObject();
        json.put("success", false);
        json.put("message", message);
        return new OperationResult(outcome, json, null, null);
    }

    public static OperationResult badRequest(String message) {
        return failure(Outcome.BAD_REQUEST, message);
    }

    public static OperationResult unauthorized() {
        return failure(Outcome.UNAUTHORIZED, "Unauthorized");
    }

    public static OperationResult notFound(String message) {
        return failure(Outcome.NOT_FOUND, message);
    }

    public static OperationResult conflict(String message) {
        return failure(Outcome.CONFLICT, message);
    }

    public static OperationResult internal(String message) {
        return failure(Outcome.INTERNAL, message != null ? message : "Internal server error");
    }

    public static OperationResult file(Path file) {
        return new OperationResult(Outcome.OK, null, file, null);
    }

    public static OperationResult html(Outcome outcome, String html) {
        return new OperationResult(outcome, null, null, html);
    }

    public OperationResult with(String key, Object value) {
        json.put(key, value);
        return this;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == Outcome.OK;
    }

    /**
     * JSON body, or null for file and HTML results
     */
    public JSONObject getJson() {
        return json;
    }

    public Path getFile() {
        return file;
    }

    public String getHtml() {
        return html;
    }
}
