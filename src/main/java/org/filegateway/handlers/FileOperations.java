package org.filegateway.handlers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.filegateway.multipart.MultipartParser;
import org.filegateway.multipart.UploadedFile;
import org.filegateway.security.PathResolution;
import org.filegateway.security.PathResolver;
import org.filegateway.utils.GatewayLogger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * File operations inside the caller's sandbox.
 *
 * <p>Each operation resolves the client path first. A path that cannot be
 * resolved answers Unauthorized whether the token was bad or the path tried
 * to leave the sandbox. I/O failures answer Internal with the failure
 * message.
 */
public class FileOperations {

    private static final String TAG = "FILES";

    private final PathResolver resolver;
    private final MultipartParser multipartParser;

    public FileOperations(PathResolver resolver, MultipartParser multipartParser) {
        this.resolver = resolver;
        this.multipartParser = multipartParser;
    }

    /**
     * Directories first, then files, each group by name. A missing
     * directory lists as empty.
     */
    public OperationResult list(GatewayRequest request) {
        PathResolution dir = resolver.resolve(request.bearerToken(), request.param("path", "/"));
        if (!dir.isResolved()) {
            return OperationResult.unauthorized();
        }

        JSONArray items = new JSONArray();
        if (!Files.isDirectory(dir.getPath())) {
            return OperationResult.success().with("items", items);
        }

        try {
            List<ListedItem> listed = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir.getPath())) {
                for (Path entry : stream) {
                    ListedItem item = ListedItem.of(entry);
                    if (item != null) {
                        listed.add(item);
                    }
                }
            }
            listed.sort(Comparator.comparing((ListedItem item) -> !item.directory)
                .thenComparing(item -> item.name));
            for (ListedItem item : listed) {
                items.put(item.toJSON());
            }
            return OperationResult.success().with("items", items);
        } catch (IOException e) {
            GatewayLogger.error(TAG, "List error for " + dir.getPath() + ": " + e.getMessage());
            return OperationResult.internal(e.getMessage());
        }
    }

    /**
     * Stores the single file part of a multipart body in the {@code path}
     * directory, replacing any file of the same name.
     */
    public OperationResult upload(GatewayRequest request) {
        PathResolution dir = resolver.resolve(request.bearerToken(), request.param("path", "/"));
        if (!dir.isResolved()) {
            return OperationResult.unauthorized();
        }

        UploadedFile upload = multipartParser.parse(request.contentType(), request.body());
        if (upload == null) {
            return OperationResult.badRequest("No filename found");
        }
        String filename = baseName(upload.getFilename());
        if (filename.isEmpty() || ".".equals(filename) || "..".equals(filename)) {
            GatewayLogger.security(TAG, "Rejected upload filename '" + upload.getFilename() + "' from user: " + dir.getUsername());
            return OperationResult.badRequest("Invalid filename");
        }

        Path target = dir.getPath().resolve(filename);
        try {
            Files.createDirectories(dir.getPath());
            Files.write(target, upload.getContent());
            GatewayLogger.info(TAG, "File uploaded by " + dir.getUsername() + ": " + target + " (" + upload.getSize() + " bytes)");
            return OperationResult.success()
                .with("filename", filename)
                .with("size", upload.getSize());
        } catch (IOException e) {
            GatewayLogger.error(TAG, "Upload error for " + target + ": " + e.getMessage());
            return OperationResult.internal(e.getMessage());
        }
    }

    public OperationResult download(GatewayRequest request) {
        PathResolution file = resolver.resolve(request.bearerToken(), request.param("path"));
        if (!file.isResolved()) {
            return OperationResult.unauthorized();
        }
        if (!Files.isRegularFile(file.getPath())) {
            return OperationResult.notFound("File not found");
        }
        return OperationResult.file(file.getPath());
    }

    /**
     * Two request forms: a {@code path} query parameter always creates a
     * directory; otherwise a JSON body {@code {path, isDirectory}} creates
     * an empty file or a directory. Creating a file over an existing one
     * empties it.
     */
    public OperationResult create(GatewayRequest request) {
        String pathParam = request.param("path");
        boolean isDirectory = true;

        if (pathParam == null || pathParam.isEmpty()) {
            JSONObject data = parseBody(request);
            if (data == null || data.optString("path", null) == null) {
                return OperationResult.badRequest("Path is required.");
            }
            pathParam = data.optString("path");
            isDirectory = data.optBoolean("isDirectory", false);
        }

        PathResolution item = resolver.resolve(request.bearerToken(), pathParam);
        if (!item.isResolved()) {
            return OperationResult.unauthorized();
        }

        Path target = item.getPath();
        try {
            if (isDirectory) {
                Files.createDirectories(target);
            } else {
                if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
                    return OperationResult.conflict("An item with this name already exists.");
                }
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                // an existing file is emptied
                Files.write(target, new byte[0]);
            }
            GatewayLogger.info(TAG, (isDirectory ? "Directory" : "File") + " created by " + item.getUsername() + ": " + target);
            return OperationResult.success("Item created successfully.");
        } catch (FileAlreadyExistsException e) {
            return OperationResult.conflict("An item with this name already exists.");
        } catch (IOException e) {
            GatewayLogger.error(TAG, "Create error for " + target + ": " + e.getMessage());
            return OperationResult.internal(e.getMessage());
        }
    }

    /**
     * Deletes a file, or a directory tree when {@code isDir=true}
     */
    public OperationResult delete(GatewayRequest request) {
        boolean isDir = Boolean.parseBoolean(request.param("isDir", "false"));
        PathResolution item = resolver.resolve(request.bearerToken(), request.param("path"));
        if (!item.isResolved()) {
            return OperationResult.unauthorized();
        }
        if (item.isSandboxRoot()) {
            GatewayLogger.security(TAG, "Refused to delete sandbox root of user: " + item.getUsername());
            return OperationResult.badRequest("Cannot delete the root folder.");
        }

        Path target = item.getPath();
        try {
            if (isDir) {
                if (!Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
                    return OperationResult.notFound("Directory not found");
                }
                deleteTree(target);
            } else {
                if (!Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
                    return OperationResult.notFound("File not found");
                }
                Files.delete(target);
            }
            GatewayLogger.info(TAG, (isDir ? "Directory" : "File") + " deleted by " + item.getUsername() + ": " + target);
            return OperationResult.success();
        } catch (IOException e) {
            GatewayLogger.error(TAG, "Delete error for " + target + ": " + e.getMessage());
            return OperationResult.internal(e.getMessage());
        }
    }

    /**
     * Replaces a file's content with the given text, creating parents
     */
    public OperationResult save(GatewayRequest request) {
        JSONObject data = parseBody(request);
        if (data == null || data.optString("path", null) == null || data.optString("content", null) == null) {
            return OperationResult.badRequest("Path and content are required.");
        }

        PathResolution item = resolver.resolve(request.bearerToken(), data.optString("path"));
        if (!item.isResolved()) {
            return OperationResult.unauthorized();
        }

        Path target = item.getPath();
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, data.optString("content"), StandardCharsets.UTF_8);
            GatewayLogger.info(TAG, "File saved by " + item.getUsername() + ": " + target);
            return OperationResult.success("File saved successfully.");
        } catch (IOException e) {
            GatewayLogger.error(TAG, "Save error for " + target + ": " + e.getMessage());
            return OperationResult.internal(e.getMessage());
        }
    }

    /**
     * Renames an item within its directory. The new sibling path goes
     * through the same resolution as any client path.
     */
    public OperationResult rename(GatewayRequest request) {
        JSONObject data = parseBody(request);
        if (data == null || !data.has("path") || !data.has("newName") || !data.has("isDirectory")) {
            return OperationResult.badRequest("Path, newName, and isDirectory are required.");
        }
        String path = data.optString("path");
        String newName = data.optString("newName");
        boolean isDirectory = data.optBoolean("isDirectory", false);

        if (newName.isEmpty() || newName.indexOf('/') >= 0 || newName.indexOf('\\') >= 0) {
            return OperationResult.badRequest("Invalid name.");
        }

        String token = request.bearerToken();
        PathResolution source = resolver.resolve(token, path);
        if (!source.isResolved()) {
            return OperationResult.unauthorized();
        }
        if (source.isSandboxRoot()) {
            return OperationResult.badRequest("Cannot rename the root folder.");
        }
        PathResolution target = resolver.resolve(token, siblingPath(path, newName));
        if (!target.isResolved()) {
            return OperationResult.unauthorized();
        }

        boolean exists = isDirectory
            ? Files.isDirectory(source.getPath(), LinkOption.NOFOLLOW_LINKS)
            : Files.isRegularFile(source.getPath(), LinkOption.NOFOLLOW_LINKS);
        if (!exists) {
            return OperationResult.notFound("Item not found");
        }
        if (Files.exists(target.getPath(), LinkOption.NOFOLLOW_LINKS)) {
            return OperationResult.conflict("An item with this name already exists.");
        }

        try {
            try {
                Files.move(source.getPath(), target.getPath(), StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source.getPath(), target.getPath());
            }
            GatewayLogger.info(TAG, "Item renamed by " + source.getUsername() + ": "
                + source.getPath().getFileName() + " to " + newName);
            return OperationResult.success("Item renamed successfully.");
        } catch (FileAlreadyExistsException e) {
            return OperationResult.conflict("An item with this name already exists.");
        } catch (IOException e) {
            GatewayLogger.error(TAG, "Rename error for " + source.getPath() + ": " + e.getMessage());
            return OperationResult.internal(e.getMessage());
        }
    }

    /**
     * Client path of the item named {@code newName} next to {@code path}
     */
    static String siblingPath(String path, String newName) {
        String clean = path.replace('\\', '/');
        while (clean.endsWith("/")) {
            clean = clean.substring(0, clean.length() - 1);
        }
        int slash = clean.lastIndexOf('/');
        String parent = slash >= 0 ? clean.substring(0, slash) : "";
        return parent + "/" + newName;
    }

    /**
     * Last segment of a client supplied file name; browsers may send a
     * full Windows path
     */
    static String baseName(String filename) {
        int cut = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        return filename.substring(cut + 1).trim();
    }

    private static JSONObject parseBody(GatewayRequest request) {
        String body = request.bodyText();
        if (body.isBlank()) {
            return null;
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            return null;
        }
    }

    private static void deleteTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * One row of a directory listing
     */
    private static class ListedItem {
        final String name;
        final boolean directory;
        final long size;
        final String lastModified;

        private ListedItem(String name, boolean directory, long size, String lastModified) {
            this.name = name;
            this.directory = directory;
            this.size = size;
            this.lastModified = lastModified;
        }

        /**
         * @return null if the entry's attributes cannot be read
         */
        static ListedItem of(Path entry) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class);
                return new ListedItem(
                    entry.getFileName().toString(),
                    attrs.isDirectory(),
                    attrs.isDirectory() ? 0L : attrs.size(),
                    attrs.lastModifiedTime().toInstant().toString());
            } catch (IOException e) {
                GatewayLogger.warn(TAG, "Skipping unreadable entry " + entry + ": " + e.getMessage());
                return null;
            }
        }

        JSONObject toJSON() {
            JSONObject json = new JSONObject();
            json.put("name", name);
            json.put("isDirectory", directory);
            json.put("size", size);
            json.put("lastModified", lastModified);
            return json;
        }
    }
}
