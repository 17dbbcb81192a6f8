package org.filegateway.multipart;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a single file part from a multipart/form-data body.
 * Only the first part is read; any further parts are ignored.
 */
public class MultipartParser {

    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};
    private static final Pattern FILENAME = Pattern.compile("filename=\"([^\"]*)\"");

    /**
     * @return the file part, or null if the body has no usable file part
     */
    public UploadedFile parse(String contentType, byte[] body) {
        String boundary = extractBoundary(contentType);
        if (boundary == null || body == null) {
            return null;
        }
        byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);

        int start = indexOf(body, delimiter, 0);
        if (start == -1) {
            return null;
        }
        start += delimiter.length;

        int headerEnd = indexOf(body, HEADER_END, start);
        if (headerEnd == -1) {
            return null;
        }
        int contentStart = headerEnd + HEADER_END.length;

        // next delimiter ends the part; for a single part it is the closing "--boundary--"
        int contentEnd = indexOf(body, delimiter, contentStart);
        if (contentEnd == -1) {
            return null;
        }

        String headers = new String(body, start, headerEnd - start, StandardCharsets.UTF_8);
        Matcher matcher = FILENAME.matcher(headers);
        if (!matcher.find() || matcher.group(1).isEmpty()) {
            return null;
        }
        String filename = matcher.group(1);

        if (contentEnd - contentStart >= 2 && body[contentEnd - 2] == '\r' && body[contentEnd - 1] == '\n') {
            contentEnd -= 2;
        }
        byte[] content = Arrays.copyOfRange(body, contentStart, contentEnd);
        return new UploadedFile(filename, content);
    }

    /**
     * Boundary parameter of a multipart Content-Type header, unquoted
     */
    static String extractBoundary(String contentType) {
        if (contentType == null) {
            return null;
        }
        for (String param : contentType.split(";")) {
            String trimmed = param.trim();
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = trimmed.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            if (!"boundary".equals(name)) {
                continue;
            }
            String value = trimmed.substring(eq + 1).trim();
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            return value.isEmpty() ? null : value;
        }
        return null;
    }

    static int indexOf(byte[] source, byte[] pattern, int fromIndex) {
        outer:
        for (int i = fromIndex; i <= source.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (source[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
