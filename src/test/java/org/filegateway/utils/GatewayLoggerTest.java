package org.filegateway.utils;

import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GatewayLoggerTest {

    @Before
    public void setUp() {
        GatewayLogger.clearLogs();
    }

    @Test
    public void testEntriesAreFilteredByLevel() {
        GatewayLogger.info("TEST", "started");
        GatewayLogger.security("SANDBOX", "blocked");
        GatewayLogger.error("TEST", "failed");

        assertEquals(3, GatewayLogger.getLogs().size());
        assertEquals(3, GatewayLogger.getLogs("ALL").size());

        List<GatewayLogger.LogEntry> security = GatewayLogger.getLogs(GatewayLogger.SECURITY);
        assertEquals(1, security.size());
        assertEquals("SANDBOX", security.get(0).source);
        assertTrue(security.get(0).toString().contains("blocked"));
    }

    @Test
    public void testBufferIsBounded() {
        for (int i = 0; i < GatewayConfig.MAX_LOGS + 10; i++) {
            GatewayLogger.log(GatewayLogger.INFO, "TEST", "entry " + i);
        }

        List<GatewayLogger.LogEntry> logs = GatewayLogger.getLogs();
        assertEquals(GatewayConfig.MAX_LOGS, logs.size());
        assertEquals("entry 10", logs.get(0).message);
    }
}
