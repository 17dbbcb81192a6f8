package org.filegateway.utils;

import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;

/**
 * Centralized gateway logging.
 * Every entry goes to the console and to a bounded in-memory buffer.
 */
public class GatewayLogger {

    public static final String INFO = "INFO";
    public static final String WARN = "WARN";
    public static final String ERROR = "ERROR";
    public static final String SECURITY = "SECURITY";

    private static final Queue<LogEntry> serverLogs = new LinkedList<>();
    private static final int MAX_LOGS = GatewayConfig.MAX_LOGS;
    private static final boolean CONSOLE_LOGGING =
        Boolean.parseBoolean(System.getenv().getOrDefault("CONSOLE_LOGGING", "true"));

    /**
     * Log entry
     */
    public static class LogEntry {
        public final long timestamp;
        public final String level;
        public final String source;
        public final String message;
        public final String formattedTime;

        public LogEntry(String level, String source, String message) {
            this.timestamp = System.currentTimeMillis();
            this.level = level;
            this.source = source;
            this.message = message;
            this.formattedTime = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss").format(new Date(timestamp));
        }

        @Override
        public String toString() {
            return String.format("[%s] %-8s [%-10s] %s", formattedTime, level, source, message);
        }
    }

    public static void log(String level, String source, String message) {
        LogEntry entry = new LogEntry(level, source, message);

        synchronized (serverLogs) {
            serverLogs.offer(entry);
            if (serverLogs.size() > MAX_LOGS) {
                serverLogs.poll();
            }
        }

        if (CONSOLE_LOGGING) {
            if (ERROR.equals(level)) {
                System.err.println(entry);
            } else {
                System.out.println(entry);
            }
        }
    }

    public static void info(String source, String message) {
        log(INFO, source, message);
    }

    public static void warn(String source, String message) {
        log(WARN, source, message);
    }

    public static void error(String source, String message) {
        log(ERROR, source, message);
    }

    public static void security(String source, String message) {
        log(SECURITY, source, message);
    }

    /**
     * Gets all buffered entries, oldest first
     */
    public static List<LogEntry> getLogs() {
        synchronized (serverLogs) {
            return new ArrayList<>(serverLogs);
        }
    }

    /**
     * Gets buffered entries of one level ("ALL" or null for every level)
     */
    public static List<LogEntry> getLogs(String level) {
        synchronized (serverLogs) {
            List<LogEntry> filtered = new ArrayList<>();
            for (LogEntry entry : serverLogs) {
                if (level == null || "ALL".equals(level) || entry.level.equals(level)) {
                    filtered.add(entry);
                }
            }
            return filtered;
        }
    }

    public static void clearLogs() {
        synchronized (serverLogs) {
            serverLogs.clear();
        }
    }
}
