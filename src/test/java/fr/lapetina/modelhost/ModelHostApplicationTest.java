package fr.lapetina.modelhost;

import fr.lapetina.modelhost.integration.TestServiceFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ModelHostApplicationTest {

    @TempDir
    Path workDir;

    @Test
    @DisplayName("should start the HTTP server and serve the models list until closed")
    void shouldServeUntilClosed() throws Exception {
        HttpClient client = HttpClient.newHttpClient();

        try (ModelHostApplication app = new ModelHostApplication(TestServiceFactory.prepare(workDir))) {
            app.start();
            int port = app.getHttpServer().getPort();
            assertThat(port).isPositive();

            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/models"))
                            .timeout(Duration.ofSeconds(5))
                            .build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("\"alpha\"").contains("\"beta\"");
            assertThat(app.getFactory().getTelemetrySampler().isRunning()).isTrue();
        }
    }

    @Test
    @DisplayName("should release the shutdown latch on request")
    void shouldReleaseShutdownLatch() throws Exception {
        try (ModelHostApplication app = new ModelHostApplication(TestServiceFactory.prepare(workDir))) {
            app.requestShutdown();
            app.awaitShutdown();
        }
    }
}
