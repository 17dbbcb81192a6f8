package org.filegateway.utils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Gateway configuration.
 * Values come from environment variables, with the defaults below.
 */
public class GatewayConfig {

    public static final int DEFAULT_PORT = 8082;
    public static final String DEFAULT_ROOT_FOLDER = "/var/www/";
    public static final String DEFAULT_FOLDERS_FILE = "sftp.json";
    public static final long DEFAULT_SESSION_TTL_HOURS = 2;
    public static final int DEFAULT_MAX_UPLOAD_BYTES = 64 * 1024 * 1024; // 64 MB
    public static final int MAX_LOGS = 1000;

    private int port;
    private String bindAddress;
    private Path rootFolder;
    private Path foldersFile;
    private Duration sessionTtl;
    private int maxUploadBytes;
    private int handlerThreads;
    private int maxFailedLogins;
    private Duration lockoutDuration;
    private String adminUsername;
    private String adminPassword;
    private Path landingPage;

    public GatewayConfig() {
        this.port = DEFAULT_PORT;
        this.bindAddress = "0.0.0.0";
        this.rootFolder = Paths.get(DEFAULT_ROOT_FOLDER);
        this.foldersFile = Paths.get(DEFAULT_FOLDERS_FILE);
        this.sessionTtl = Duration.ofHours(DEFAULT_SESSION_TTL_HOURS);
        this.maxUploadBytes = DEFAULT_MAX_UPLOAD_BYTES;
        this.handlerThreads = 16;
        this.maxFailedLogins = 5;
        this.lockoutDuration = Duration.ofMinutes(15);
        this.adminUsername = "admin";
        this.adminPassword = "admin123";
        this.landingPage = null;
    }

    /**
     * Builds the configuration from the process environment.
     */
    public static GatewayConfig fromEnvironment() {
        GatewayConfig config = new GatewayConfig();
        config.port = Integer.parseInt(env("PORT", String.valueOf(DEFAULT_PORT)));
        config.bindAddress = env("BIND_ADDRESS", "0.0.0.0");
        config.rootFolder = Paths.get(env("ROOT_FOLDER", DEFAULT_ROOT_FOLDER));
        config.foldersFile = Paths.get(env("FOLDERS_FILE", DEFAULT_FOLDERS_FILE));
        config.sessionTtl = Duration.ofHours(Long.parseLong(env("SESSION_TTL_HOURS", String.valueOf(DEFAULT_SESSION_TTL_HOURS))));
        config.maxUploadBytes = Integer.parseInt(env("MAX_UPLOAD_BYTES", String.valueOf(DEFAULT_MAX_UPLOAD_BYTES)));
        config.handlerThreads = Integer.parseInt(env("HANDLER_THREADS", "16"));
        config.maxFailedLogins = Integer.parseInt(env("MAX_FAILED_LOGINS", "5"));
        config.lockoutDuration = Duration.ofMinutes(Long.parseLong(env("LOCKOUT_MINUTES", "15")));
        config.adminUsername = env("ADMIN_USERNAME", "admin");
        config.adminPassword = env("ADMIN_PASSWORD", "admin123");
        String landing = env("LANDING_PAGE", "");
        config.landingPage = landing.isEmpty() ? null : Paths.get(landing);
        return config;
    }

    private static String env(String name, String defaultValue) {
        return System.getenv().getOrDefault(name, defaultValue);
    }

    public int getPort() {
        return port;
    }

    public GatewayConfig withPort(int port) {
        this.port = port;
        return this;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public GatewayConfig withBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
        return this;
    }

    public Path getRootFolder() {
        return rootFolder;
    }

    public GatewayConfig withRootFolder(Path rootFolder) {
        this.rootFolder = rootFolder;
        return this;
    }

    public Path getFoldersFile() {
        return foldersFile;
    }

    public GatewayConfig withFoldersFile(Path foldersFile) {
        this.foldersFile = foldersFile;
        return this;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public GatewayConfig withSessionTtl(Duration sessionTtl) {
        this.sessionTtl = sessionTtl;
        return this;
    }

    public int getMaxUploadBytes() {
        return maxUploadBytes;
    }

    public GatewayConfig withMaxUploadBytes(int maxUploadBytes) {
        this.maxUploadBytes = maxUploadBytes;
        return this;
    }

    public int getHandlerThreads() {
        return handlerThreads;
    }

    public GatewayConfig withHandlerThreads(int handlerThreads) {
        this.handlerThreads = handlerThreads;
        return this;
    }

    public int getMaxFailedLogins() {
        return maxFailedLogins;
    }

    public GatewayConfig withMaxFailedLogins(int maxFailedLogins) {
        this.maxFailedLogins = maxFailedLogins;
        return this;
    }

    public Duration getLockoutDuration() {
        return lockoutDuration;
    }

    public GatewayConfig withLockoutDuration(Duration lockoutDuration) {
        this.lockoutDuration = lockoutDuration;
        return this;
    }

    public String getAdminUsername() {
        return adminUsername;
    }

    public GatewayConfig withAdminUsername(String adminUsername) {
        this.adminUsername = adminUsername;
        return this;
    }

    public String getAdminPassword() {
        return adminPassword;
    }

    public GatewayConfig withAdminPassword(String adminPassword) {
        this.adminPassword = adminPassword;
        return this;
    }

    /**
     * Optional landing page on disk; null means the bundled page.
     */
    public Path getLandingPage() {
        return landingPage;
    }

    public GatewayConfig withLandingPage(Path landingPage) {
        this.landingPage = landingPage;
        return this;
    }
}
