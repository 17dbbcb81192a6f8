package org.filegateway.managers;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import org.filegateway.utils.GatewayLogger;

/**
 * Maps usernames to their sandbox subfolder under the root folder.
 * Users without an entry use their username as folder name. The
 * administrative account is always mapped to the root itself.
 */
public class FolderMapping {

    private static final String TAG = "PERSISTENCE";
    public static final String ROOT_FOLDER = "/";

    private final Map<String, String> usersFolders = new ConcurrentHashMap<>();
    private final Path file;
    private final String adminUsername;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * On-disk document
     */
    private static class FolderMappingFile {
        Map<String, String> usersFolders;
    }

    public FolderMapping(Path file, String adminUsername) {
        this.file = file;
        this.adminUsername = adminUsername;
        usersFolders.put(adminUsername, ROOT_FOLDER);
    }

    /**
     * Sandbox subfolder for the user
     */
    public String folderFor(String username) {
        return usersFolders.getOrDefault(username, username);
    }

    public void assign(String username, String folder) {
        usersFolders.put(username, folder);
    }

    /**
     * Removes the user's entry. The administrative entry is kept.
     */
    public void remove(String username) {
        if (adminUsername.equals(username)) {
            GatewayLogger.warn(TAG, "Refusing to remove reserved folder entry for " + username);
            return;
        }
        usersFolders.remove(username);
    }

    /**
     * Sorted copy of the table
     */
    public Map<String, String> snapshot() {
        return new TreeMap<>(usersFolders);
    }

    /**
     * Writes the whole table, replacing the previous file in one move
     */
    public void save() throws IOException {
        FolderMappingFile document = new FolderMappingFile();
        document.usersFolders = snapshot();

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            gson.toJson(document, writer);
        }
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }

        GatewayLogger.info(TAG, "Saved " + document.usersFolders.size() + " folder mappings to " + file);
    }

    /**
     * Replaces the table with the file's contents. A missing file leaves
     * only the administrative entry.
     */
    public void load() throws IOException {
        usersFolders.clear();

        if (Files.exists(file)) {
            FolderMappingFile document;
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                document = gson.fromJson(reader, FolderMappingFile.class);
            } catch (JsonParseException e) {
                throw new IOException("Malformed folder mapping file " + file + ": " + e.getMessage(), e);
            }
            if (document != null && document.usersFolders != null) {
                usersFolders.putAll(document.usersFolders);
            }
            GatewayLogger.info(TAG, "Loaded " + usersFolders.size() + " folder mappings from " + file);
        } else {
            GatewayLogger.info(TAG, "No folder mapping file found, starting fresh");
        }

        usersFolders.putIfAbsent(adminUsername, ROOT_FOLDER);
    }
}
