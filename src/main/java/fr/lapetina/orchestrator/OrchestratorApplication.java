package fr.lapetina.orchestrator;

import fr.lapetina.orchestrator.api.DiagnosticsServer;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the AI provider orchestrator.
 */
public class OrchestratorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorApplication.class);

    private final AiOrchestrator orchestrator;
    private final DiagnosticsServer diagnosticsServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public OrchestratorApplication(String configPath) throws Exception {
        log.info("Starting AI provider orchestrator...");

        this.orchestrator = AiOrchestrator.create(configPath).start();

        OrchestratorConfig.ServerConfig server = orchestrator.getConfig().getServer();
        if (server.isEnabled()) {
            this.diagnosticsServer = new DiagnosticsServer(
                    server.getHost(),
                    server.getPort(),
                    server.getBacklog(),
                    server.getThreads(),
                    orchestrator
            );
        } else {
            this.diagnosticsServer = null;
            log.info("Diagnostics server disabled");
        }

        log.info("AI provider orchestrator initialized");
    }

    public void start() {
        if (diagnosticsServer != null) {
            diagnosticsServer.start();
            log.info("AI provider orchestrator started on port {}", diagnosticsServer.getPort());
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public AiOrchestrator getOrchestrator() {
        return orchestrator;
    }

    @Override
    public void close() {
        log.info("Shutting down AI provider orchestrator...");

        if (diagnosticsServer != null) {
            try {
                diagnosticsServer.close();
            } catch (Exception e) {
                log.warn("Error closing diagnostics server", e);
            }
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        log.info("AI provider orchestrator shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            OrchestratorApplication app = new OrchestratorApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start AI provider orchestrator", e);
            System.exit(1);
        }
    }
}
