package io.github.hongjungwan.loganalytics.core.transport;

import io.github.hongjungwan.loganalytics.spi.IngestionRequest;
import io.github.hongjungwan.loganalytics.spi.IngestionResponse;
import io.github.hongjungwan.loganalytics.spi.IngestionTransport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * JDK HttpClient 기반 전송. 요청 타임아웃 30초 고정, 클라이언트는 모든 호출이 공유.
 */
@Slf4j
public class JdkHttpIngestionTransport implements IngestionTransport {

    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkHttpIngestionTransport() {
        this(HttpClient.newBuilder()
                .connectTimeout(REQUEST_TIMEOUT)
                .build(), REQUEST_TIMEOUT);
    }

    JdkHttpIngestionTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public IngestionResponse post(IngestionRequest request) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()));
        request.headers().forEach(builder::header);

        try {
            HttpResponse<String> response = httpClient.send(builder.build(),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            log.debug("POST {} -> {}", request.uri(), response.statusCode());
            return new IngestionResponse(response.statusCode(), response.body());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while posting logs");
            interrupted.initCause(e);
            throw interrupted;
        }
    }
}
