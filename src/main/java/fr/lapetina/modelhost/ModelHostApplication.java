package fr.lapetina.modelhost;

import fr.lapetina.modelhost.api.HttpServer;
import fr.lapetina.modelhost.infrastructure.config.ServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Model Host.
 */
public class ModelHostApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelHostApplication.class);

    private final ServiceFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ModelHostApplication(String configPath) throws Exception {
        this(ServiceFactory.create(configPath));
    }

    ModelHostApplication(ServiceFactory factory) throws Exception {
        log.info("Starting Model Host...");

        this.factory = factory.start();

        ServiceConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = server.isEnabled()
                ? new HttpServer(
                        server.getHost(),
                        server.getPort(),
                        server.getBacklog(),
                        server.getWorkerThreads(),
                        factory.getLifecycleManager(),
                        factory.getTelemetryStore(),
                        factory.getMetricSource(),
                        factory.getHealthAggregator(),
                        factory.getConfig().getMetrics().isEnabled() ? factory.getMetricsRegistry() : null)
                : null;

        log.info("Model Host initialized");
    }

    public void start() {
        if (httpServer != null) {
            httpServer.start();
            log.info("Model Host started on port {}", httpServer.getPort());
        } else {
            log.info("Model Host started without HTTP server");
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ServiceFactory getFactory() {
        return factory;
    }

    public HttpServer getHttpServer() {
        return httpServer;
    }

    @Override
    public void close() {
        log.info("Shutting down Model Host...");

        if (httpServer != null) {
            try {
                httpServer.close();
            } catch (Exception e) {
                log.warn("Error closing HTTP server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Model Host shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            ModelHostApplication app = new ModelHostApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Model Host", e);
            System.exit(1);
        }
    }
}
