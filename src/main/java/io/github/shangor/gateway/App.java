package io.github.shangor.gateway;

import io.github.shangor.gateway.config.GatewayConfig;
import io.github.shangor.gateway.server.GatewayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        try {
            // configured from pinnedGateway.* system properties
            GatewayConfig config = new GatewayConfig();

            GatewayServer server = new GatewayServer(config);
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "gateway-shutdown"));
            server.start();
        } catch (Exception e) {
            log.error("Failed to start gateway", e);
        }
    }
}
