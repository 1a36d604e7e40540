package io.github.hongjungwan.loganalytics.test;

import io.github.hongjungwan.loganalytics.api.LogShipper;
import io.github.hongjungwan.loganalytics.api.LogShippers;
import io.github.hongjungwan.loganalytics.api.config.LogAnalyticsConfig;
import io.github.hongjungwan.loganalytics.api.exception.HttpStatusException;
import io.github.hongjungwan.loganalytics.api.exception.TransportException;
import io.github.hongjungwan.loganalytics.core.resilience.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static io.github.hongjungwan.loganalytics.test.IngestionRequestAssert.assertThatRequest;
import static org.assertj.core.api.Assertions.*;

/**
 * Test RecordingIngestionTransport with a real LogShipper
 */
class RecordingIngestionTransportTest {

    private final LogAnalyticsConfig config = LogAnalyticsConfig.defaultConfig("ws", "SmVmZQ==", "AppLogs");

    @Test
    void testDefaultsToOk() {
        RecordingIngestionTransport transport = new RecordingIngestionTransport();

        try (LogShipper shipper = LogShippers.builder(config).transport(transport).build()) {
            shipper.postMessage("hello", null);
        }

        assertThat(transport.getRequests()).hasSize(1);
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void testScriptedRetry() throws InterruptedException {
        RecordingIngestionTransport transport = new RecordingIngestionTransport()
                .respondWith(503, "busy")
                .respondWith(200);

        try (LogShipper shipper = LogShippers.builder(config)
                .transport(transport)
                .retryPolicy(RetryPolicy.builder().fixedDelay(Duration.ofMillis(20)).build())
                .build()) {

            assertThatThrownBy(() -> shipper.postMessages(List.of("x", "y"), null))
                    .isInstanceOf(HttpStatusException.class);

            assertThat(transport.awaitRequests(2, Duration.ofSeconds(2))).isTrue();
        }

        List<byte[]> bodies = transport.getRequests().stream().map(r -> r.body()).toList();
        assertThat(bodies.get(1)).isEqualTo(bodies.get(0));
        assertThatRequest(transport.lastRequest()).hasMessages("x", "y");
    }

    @Test
    void testScriptedConnectionFailure() {
        RecordingIngestionTransport transport = new RecordingIngestionTransport()
                .failWith(new IOException("connection reset"));

        try (LogShipper shipper = LogShippers.builder(config).transport(transport).build()) {
            assertThatThrownBy(() -> shipper.postMessage("lost", null))
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("connection reset");
        }
    }

    @Test
    void testLastRequestWithoutRequests() {
        assertThatThrownBy(() -> new RecordingIngestionTransport().lastRequest())
                .isInstanceOf(IllegalStateException.class);
    }
}
