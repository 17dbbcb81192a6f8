package org.filegateway;

import org.filegateway.accounts.LocalUserStore;
import org.filegateway.utils.GatewayConfig;
import org.filegateway.utils.GatewayLogger;

public class Main {
    public static void main(String[] args) throws Exception {
        GatewayConfig config = GatewayConfig.fromEnvironment();

        LocalUserStore users = new LocalUserStore(config.getMaxFailedLogins(), config.getLockoutDuration());
        users.createAccount(config.getAdminUsername(), config.getAdminPassword());

        FileGatewayServer server = new FileGatewayServer(config, users, users);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "gateway-shutdown"));
        server.start();

        GatewayLogger.info("SYSTEM", "File gateway listening on port " + server.getPort());
    }
}
