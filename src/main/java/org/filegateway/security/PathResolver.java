package org.filegateway.security;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

import org.filegateway.managers.FolderMapping;
import org.filegateway.managers.SessionStore;
import org.filegateway.utils.GatewayLogger;

/**
 * Turns a client supplied relative path into an absolute path inside the
 * caller's sandbox.
 *
 * <p>Two independent checks guard the sandbox: any path containing {@code ..}
 * is rejected as a raw string before it is touched, and the canonical result
 * must lie under the canonical sandbox base, compared segment by segment.
 * Canonicalization follows symlinks on the part of the path that exists.
 */
public class PathResolver {

    private static final String TAG = "SANDBOX";
    private static final String PARENT_REFERENCE = "..";

    private final Path rootFolder;
    private final SessionStore sessions;
    private final FolderMapping folders;

    public PathResolver(Path rootFolder, SessionStore sessions, FolderMapping folders) {
        this.rootFolder = rootFolder;
        this.sessions = sessions;
        this.folders = folders;
    }

    public PathResolution resolve(String token, String clientPath) {
        String username = sessions.validate(token);
        if (username == null) {
            return PathResolution.unauthorized();
        }

        String folder = folders.folderFor(username);

        if (clientPath != null && clientPath.contains(PARENT_REFERENCE)) {
            GatewayLogger.security(TAG, "Path traversal attempt blocked: '" + clientPath + "' from user: " + username);
            return PathResolution.forbidden();
        }
        if (folder == null || folder.contains(PARENT_REFERENCE)) {
            GatewayLogger.security(TAG, "Invalid sandbox folder '" + folder + "' for user: " + username);
            return PathResolution.forbidden();
        }

        String cleanFolder = clean(folder);
        if (cleanFolder.isEmpty() && !FolderMapping.ROOT_FOLDER.equals(folder)) {
            GatewayLogger.security(TAG, "Empty sandbox folder for user: " + username);
            return PathResolution.forbidden();
        }
        String cleanPath = clean(clientPath);

        try {
            Path userBase = canonicalize(rootFolder.resolve(cleanFolder));
            Path candidate = canonicalize(userBase.resolve(cleanPath));

            if (!candidate.startsWith(userBase)) {
                GatewayLogger.security(TAG, "Sandbox escape blocked: '" + clientPath + "' resolved to " + candidate
                    + " for user: " + username);
                return PathResolution.forbidden();
            }
            return PathResolution.resolved(username, userBase, candidate);
        } catch (InvalidPathException | IOException e) {
            GatewayLogger.security(TAG, "Unresolvable path '" + clientPath + "' from user: " + username
                + " (" + e.getMessage() + ")");
            return PathResolution.forbidden();
        }
    }

    /**
     * Missing path means the sandbox root. Backslashes become slashes and
     * leading/trailing separators are dropped.
     */
    static String clean(String path) {
        if (path == null) {
            return "";
        }
        String result = path.replace('\\', '/');
        int start = 0;
        int end = result.length();
        while (start < end && result.charAt(start) == '/') {
            start++;
        }
        while (end > start && result.charAt(end - 1) == '/') {
            end--;
        }
        return result.substring(start, end);
    }

    /**
     * Absolute, normalized path with symlinks resolved on its longest
     * existing prefix. A dangling symlink fails with an IOException.
     */
    static Path canonicalize(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();

        Deque<Path> missing = new ArrayDeque<>();
        Path existing = absolute;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            missing.push(existing.getFileName());
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }

        Path result = existing.toRealPath();
        while (!missing.isEmpty()) {
            result = result.resolve(missing.pop());
        }
        return result;
    }
}
