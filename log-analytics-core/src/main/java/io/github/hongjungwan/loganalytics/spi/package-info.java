/**
 * Service Provider Interfaces (SPI) for the Log Analytics client.
 *
 * <p>{@link io.github.hongjungwan.loganalytics.spi.IngestionTransport} is the only
 * extension point: it receives a fully signed
 * {@link io.github.hongjungwan.loganalytics.spi.IngestionRequest} and returns the
 * {@link io.github.hongjungwan.loganalytics.spi.IngestionResponse}. The default
 * implementation uses {@code java.net.http.HttpClient}; supply another one through
 * {@code LogShippers.builder(config).transport(...)} to plug in a different HTTP stack.</p>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.loganalytics.spi;
