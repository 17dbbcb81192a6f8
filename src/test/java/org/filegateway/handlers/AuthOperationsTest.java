package org.filegateway.handlers;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import org.filegateway.accounts.LocalUserStore;
import org.filegateway.managers.FolderMapping;
import org.filegateway.managers.SessionStore;
import org.filegateway.security.PathResolver;
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

public class AuthOperationsTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private Path root;
    private SessionStore sessions;
    private LocalUserStore users;
    private AuthOperations auth;

    @Before
    public void setUp() throws IOException {
        root = tempFolder.newFolder("www").toPath().toRealPath();
        sessions = new SessionStore(Duration.ofHours(2));
        users = new LocalUserStore(2, Duration.ofMinutes(15));
        users.createAccount("alice", "wonderland");
        FolderMapping folders = new FolderMapping(tempFolder.getRoot().toPath().resolve("sftp.json"), "admin");
        auth = new AuthOperations(users, sessions, new PathResolver(root, sessions, folders));
    }

    private static GatewayRequest login(String body) {
        return new GatewayRequest(HttpMethod.POST, "/api/login", new DefaultHttpHeaders(),
            body.getBytes(StandardCharsets.UTF_8));
    }

    private static GatewayRequest logout(String token) {
        HttpHeaders headers = new DefaultHttpHeaders();
        if (token != null) {
            headers.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + token);
        }
        return new GatewayRequest(HttpMethod.POST, "/api/logout", headers, null);
    }

    @Test
    public void testLoginIssuesTokenAndCreatesFolder() {
        OperationResult result = auth.login(login("{\"Username\":\"alice\",\"Password\":\"wonderland\"}"));

        assertEquals(Outcome.OK, result.getOutcome());
        JSONObject json = result.getJson();
        assertTrue(json.getBoolean("success"));
        assertEquals("alice", json.getString("username"));
        assertEquals("alice", sessions.validate(json.getString("token")));
        assertTrue(Files.isDirectory(root.resolve("alice")));
    }

    @Test
    public void testLowerCaseKeysAccepted() {
        OperationResult result = auth.login(login("{\"username\":\"alice\",\"password\":\"wonderland\"}"));

        assertEquals(Outcome.OK, result.getOutcome());
    }

    @Test
    public void testMalformedLogin() {
        assertEquals(Outcome.BAD_REQUEST, auth.login(login("not json")).getOutcome());
        assertEquals(Outcome.BAD_REQUEST, auth.login(login("{\"Username\":\"alice\"}")).getOutcome());
        assertEquals("Invalid request format", auth.login(login("")).getJson().getString("message"));
    }

    @Test
    public void testWrongPasswordLocksAccount() {
        OperationResult result = auth.login(login("{\"Username\":\"alice\",\"Password\":\"nope\"}"));
        assertEquals(Outcome.UNAUTHORIZED, result.getOutcome());
        assertEquals("Invalid credentials", result.getJson().getString("message"));

        auth.login(login("{\"Username\":\"alice\",\"Password\":\"nope\"}"));

        result = auth.login(login("{\"Username\":\"alice\",\"Password\":\"wonderland\"}"));
        assertEquals(Outcome.UNAUTHORIZED, result.getOutcome());
        assertEquals("Too many tries", result.getJson().getString("message"));
        assertEquals(0, sessions.size());
    }

    @Test
    public void testUnknownUser() {
        OperationResult result = auth.login(login("{\"Username\":\"mallory\",\"Password\":\"x\"}"));

        assertEquals(Outcome.UNAUTHORIZED, result.getOutcome());
        assertEquals("Invalid credentials", result.getJson().getString("message"));
    }

    @Test
    public void testLogoutIsIdempotent() {
        String token = auth.login(login("{\"Username\":\"alice\",\"Password\":\"wonderland\"}"))
            .getJson().getString("token");

        assertTrue(auth.logout(logout(token)).isSuccess());
        assertNull(sessions.validate(token));
        assertTrue(auth.logout(logout(token)).isSuccess());
        assertTrue(auth.logout(logout(null)).isSuccess());
    }
}
