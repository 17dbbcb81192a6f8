package org.filegateway.handlers;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import org.filegateway.managers.FolderMapping;
import org.filegateway.managers.SessionStore;
import org.filegateway.multipart.MultipartParser;
import org.filegateway.security.PathResolver;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.Assert.*;

public class FileOperationsTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private Path home;
    private SessionStore sessions;
    private FileOperations files;
    private String token;

    @Before
    public void setUp() throws IOException {
        Path root = tempFolder.newFolder("www").toPath().toRealPath();
        home = Files.createDirectories(root.resolve("alice"));
        sessions = new SessionStore(Duration.ofHours(2));
        FolderMapping folders = new FolderMapping(tempFolder.getRoot().toPath().resolve("sftp.json"), "admin");
        files = new FileOperations(new PathResolver(root, sessions, folders), new MultipartParser());
        token = sessions.issue("alice");
    }

    private GatewayRequest get(String uri) {
        return request(HttpMethod.GET, uri, null, null);
    }

    private GatewayRequest postJson(String uri, JSONObject body) {
        return request(HttpMethod.POST, uri, "application/json", body.toString().getBytes(StandardCharsets.UTF_8));
    }

    private GatewayRequest request(HttpMethod method, String uri, String contentType, byte[] body) {
        HttpHeaders headers = new DefaultHttpHeaders();
        headers.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + token);
        if (contentType != null) {
            headers.set(HttpHeaderNames.CONTENT_TYPE, contentType);
        }
        return new GatewayRequest(method, uri, headers, body);
    }

    @Test
    public void testListMissingDirectoryIsEmpty() {
        OperationResult result = files.list(get("/api/files/list?path=/nothing-here"));

        assertEquals(Outcome.OK, result.getOutcome());
        assertEquals(0, result.getJson().getJSONArray("items").length());
    }

    @Test
    public void testListOrdersDirectoriesFirst() throws IOException {
        Files.writeString(home.resolve("b.txt"), "bb");
        Files.writeString(home.resolve("a.txt"), "a");
        Files.createDirectories(home.resolve("zdir"));

        JSONArray items = files.list(get("/api/files/list")).getJson().getJSONArray("items");

        assertEquals(3, items.length());
        assertEquals("zdir", items.getJSONObject(0).getString("name"));
        assertTrue(items.getJSONObject(0).getBoolean("isDirectory"));
        assertEquals("a.txt", items.getJSONObject(1).getString("name"));
        assertEquals(1, items.getJSONObject(1).getLong("size"));
        assertEquals("b.txt", items.getJSONObject(2).getString("name"));
        assertTrue(items.getJSONObject(2).has("lastModified"));
    }

    @Test
    public void testEscapingPathIsUnauthorized() {
        assertEquals(Outcome.UNAUTHORIZED, files.list(get("/api/files/list?path=../bob")).getOutcome());
        assertEquals(Outcome.UNAUTHORIZED, files.download(get("/api/files/download?path=../../etc/passwd")).getOutcome());
    }

    @Test
    public void testCreateFileEmptiesExistingFile() throws IOException {
        JSONObject body = new JSONObject().put("path", "/docs/new.txt").put("isDirectory", false);

        OperationResult created = files.create(postJson("/api/files/create", body));
        assertEquals(Outcome.OK, created.getOutcome());
        assertEquals("Item created successfully.", created.getJson().getString("message"));
        assertTrue(Files.isRegularFile(home.resolve("docs/new.txt")));

        Files.writeString(home.resolve("docs/new.txt"), "old content");
        assertEquals(Outcome.OK, files.create(postJson("/api/files/create", body)).getOutcome());
        assertEquals(0, Files.size(home.resolve("docs/new.txt")));
    }

    @Test
    public void testCreateFileOverDirectoryConflicts() throws IOException {
        Files.createDirectories(home.resolve("photos"));
        JSONObject body = new JSONObject().put("path", "photos").put("isDirectory", false);

        assertEquals(Outcome.CONFLICT, files.create(postJson("/api/files/create", body)).getOutcome());
        assertTrue(Files.isDirectory(home.resolve("photos")));
    }

    @Test
    public void testCreatedFileIsListed() {
        JSONObject body = new JSONObject().put("path", "notes.txt").put("isDirectory", false);
        assertEquals(Outcome.OK, files.create(postJson("/api/files/create", body)).getOutcome());

        JSONArray items = files.list(get("/api/files/list?path=/")).getJson().getJSONArray("items");
        assertEquals(1, items.length());
        assertEquals("notes.txt", items.getJSONObject(0).getString("name"));
        assertFalse(items.getJSONObject(0).getBoolean("isDirectory"));
    }

    @Test
    public void testCreateDirectoryByQueryParameter() {
        OperationResult result = files.create(request(HttpMethod.POST, "/api/files/create?path=/photos/2024", null, null));

        assertEquals(Outcome.OK, result.getOutcome());
        assertTrue(Files.isDirectory(home.resolve("photos/2024")));
    }

    @Test
    public void testCreateRequiresPath() {
        OperationResult result = files.create(postJson("/api/files/create", new JSONObject().put("isDirectory", true)));

        assertEquals(Outcome.BAD_REQUEST, result.getOutcome());
        assertEquals("Path is required.", result.getJson().getString("message"));
    }

    @Test
    public void testSaveWritesContent() throws IOException {
        JSONObject body = new JSONObject().put("path", "notes/today.txt").put("content", "héllo");

        OperationResult result = files.save(postJson("/api/files/save", body));

        assertEquals(Outcome.OK, result.getOutcome());
        assertEquals("héllo", Files.readString(home.resolve("notes/today.txt"), StandardCharsets.UTF_8));
    }

    @Test
    public void testSaveRequiresPathAndContent() {
        OperationResult result = files.save(postJson("/api/files/save", new JSONObject().put("path", "x.txt")));
        assertEquals(Outcome.BAD_REQUEST, result.getOutcome());

        result = files.save(request(HttpMethod.POST, "/api/files/save", "application/json",
            "not json".getBytes(StandardCharsets.UTF_8)));
        assertEquals(Outcome.BAD_REQUEST, result.getOutcome());
    }

    @Test
    public void testDeleteFileAndDirectory() throws IOException {
        Files.writeString(home.resolve("gone.txt"), "x");
        Files.createDirectories(home.resolve("tree/sub"));
        Files.writeString(home.resolve("tree/sub/leaf.txt"), "x");

        assertEquals(Outcome.OK, files.delete(request(HttpMethod.POST, "/api/files/delete?path=gone.txt", null, null)).getOutcome());
        assertFalse(Files.exists(home.resolve("gone.txt")));

        assertEquals(Outcome.OK, files.delete(request(HttpMethod.POST, "/api/files/delete?path=tree&isDir=true", null, null)).getOutcome());
        assertFalse(Files.exists(home.resolve("tree")));
    }

    @Test
    public void testDeleteMissingAndRoot() {
        assertEquals(Outcome.NOT_FOUND,
            files.delete(request(HttpMethod.POST, "/api/files/delete?path=missing.txt", null, null)).getOutcome());
        assertEquals(Outcome.BAD_REQUEST,
            files.delete(request(HttpMethod.POST, "/api/files/delete?path=/&isDir=true", null, null)).getOutcome());
        assertTrue(Files.isDirectory(home));
    }

    @Test
    public void testRename() throws IOException {
        Files.createDirectories(home.resolve("docs"));
        Files.writeString(home.resolve("docs/old.txt"), "data");
        JSONObject body = new JSONObject().put("path", "/docs/old.txt").put("newName", "new.txt").put("isDirectory", false);

        OperationResult result = files.rename(postJson("/api/files/rename", body));

        assertEquals(Outcome.OK, result.getOutcome());
        assertFalse(Files.exists(home.resolve("docs/old.txt")));
        assertEquals("data", Files.readString(home.resolve("docs/new.txt")));
    }

    @Test
    public void testRenameConflictAndMissing() throws IOException {
        Files.writeString(home.resolve("a.txt"), "a");
        Files.writeString(home.resolve("b.txt"), "b");

        JSONObject conflict = new JSONObject().put("path", "a.txt").put("newName", "b.txt").put("isDirectory", false);
        assertEquals(Outcome.CONFLICT, files.rename(postJson("/api/files/rename", conflict)).getOutcome());
        assertEquals("b", Files.readString(home.resolve("b.txt")));
        assertEquals("a", Files.readString(home.resolve("a.txt")));

        JSONObject missing = new JSONObject().put("path", "c.txt").put("newName", "d.txt").put("isDirectory", false);
        assertEquals(Outcome.NOT_FOUND, files.rename(postJson("/api/files/rename", missing)).getOutcome());
    }

    @Test
    public void testRenameRejectsEscapingNames() throws IOException {
        Files.writeString(home.resolve("a.txt"), "a");

        JSONObject slash = new JSONObject().put("path", "a.txt").put("newName", "x/y.txt").put("isDirectory", false);
        assertEquals(Outcome.BAD_REQUEST, files.rename(postJson("/api/files/rename", slash)).getOutcome());

        JSONObject parent = new JSONObject().put("path", "a.txt").put("newName", "..").put("isDirectory", false);
        assertEquals(Outcome.UNAUTHORIZED, files.rename(postJson("/api/files/rename", parent)).getOutcome());

        assertTrue(Files.exists(home.resolve("a.txt")));
    }

    @Test
    public void testUploadStoresFile() throws IOException {
        String multipart = "--XX\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\"C:\\Users\\me\\report.txt\"\r\n"
            + "\r\n"
            + "report body\r\n"
            + "--XX--\r\n";

        OperationResult result = files.upload(request(HttpMethod.POST, "/api/files/upload?path=/inbox",
            "multipart/form-data; boundary=XX", multipart.getBytes(StandardCharsets.UTF_8)));

        assertEquals(Outcome.OK, result.getOutcome());
        assertEquals("report.txt", result.getJson().getString("filename"));
        assertEquals(11, result.getJson().getInt("size"));
        assertEquals("report body", Files.readString(home.resolve("inbox/report.txt")));
    }

    @Test
    public void testUploadWithoutFilename() {
        String multipart = "--XX\r\nContent-Disposition: form-data; name=\"file\"\r\n\r\nbody\r\n--XX--\r\n";

        OperationResult result = files.upload(request(HttpMethod.POST, "/api/files/upload",
            "multipart/form-data; boundary=XX", multipart.getBytes(StandardCharsets.UTF_8)));

        assertEquals(Outcome.BAD_REQUEST, result.getOutcome());
        assertEquals("No filename found", result.getJson().getString("message"));
    }

    @Test
    public void testDownload() throws IOException {
        Files.writeString(home.resolve("get.txt"), "x");

        OperationResult result = files.download(get("/api/files/download?path=get.txt"));
        assertEquals(Outcome.OK, result.getOutcome());
        assertEquals(home.resolve("get.txt"), result.getFile());

        assertEquals(Outcome.NOT_FOUND, files.download(get("/api/files/download?path=none.txt")).getOutcome());
        assertEquals(Outcome.NOT_FOUND, files.download(get("/api/files/download?path=/")).getOutcome());
    }

    @Test
    public void testSiblingPath() {
        assertEquals("/docs/new.txt", FileOperations.siblingPath("/docs/old.txt", "new.txt"));
        assertEquals("/new", FileOperations.siblingPath("old/", "new"));
        assertEquals("/a/new", FileOperations.siblingPath("a\\b", "new"));
    }

    @Test
    public void testBaseName() {
        assertEquals("x.txt", FileOperations.baseName("x.txt"));
        assertEquals("x.txt", FileOperations.baseName("/tmp/x.txt"));
        assertEquals("x.txt", FileOperations.baseName("C:\\tmp\\x.txt"));
        assertEquals("", FileOperations.baseName("dir/"));
    }
}
