package org.filegateway.utils;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed extension to content type table used for downloads
 */
public class MimeTypes {

    public static final String DEFAULT_TYPE = "application/octet-stream";

    private static final Map<String, String> TYPES = new HashMap<>();

    static {
        TYPES.put("txt", "text/plain");
        TYPES.put("html", "text/html");
        TYPES.put("htm", "text/html");
        TYPES.put("css", "text/css");
        TYPES.put("js", "application/javascript");
        TYPES.put("json", "application/json");
        TYPES.put("xml", "application/xml");
        TYPES.put("pdf", "application/pdf");
        TYPES.put("doc", "application/msword");
        TYPES.put("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document");
        TYPES.put("xls", "application/vnd.ms-excel");
        TYPES.put("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
        TYPES.put("ppt", "application/vnd.ms-powerpoint");
        TYPES.put("pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation");
        TYPES.put("jpg", "image/jpeg");
        TYPES.put("jpeg", "image/jpeg");
        TYPES.put("png", "image/png");
        TYPES.put("gif", "image/gif");
        TYPES.put("svg", "image/svg+xml");
        TYPES.put("mp3", "audio/mpeg");
        TYPES.put("wav", "audio/wav");
        TYPES.put("mp4", "video/mp4");
        TYPES.put("avi", "video/x-msvideo");
        TYPES.put("mov", "video/quicktime");
        TYPES.put("zip", "application/zip");
        TYPES.put("rar", "application/x-rar-compressed");
        TYPES.put("tar", "application/x-tar");
        TYPES.put("gz", "application/gzip");
    }

    /**
     * Content type for a file name, by its last extension
     */
    public static String forFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return DEFAULT_TYPE;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return TYPES.getOrDefault(extension, DEFAULT_TYPE);
    }
}
