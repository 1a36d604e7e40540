/**
 * Public API for the Log Analytics client.
 *
 * <p>This package contains the interfaces and classes applications use directly.
 * Classes in this package are stable and follow semantic versioning.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.loganalytics.api.LogShipper} - Signed log submission</li>
 *   <li>{@link io.github.hongjungwan.loganalytics.api.LogShippers} - Client factory</li>
 *   <li>{@link io.github.hongjungwan.loganalytics.api.config.LogAnalyticsConfig} - Client configuration</li>
 *   <li>{@link io.github.hongjungwan.loganalytics.api.exception.DeliveryException} - Delivery failures</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * try (LogShipper shipper = LogShippers.create(
 *         workspaceId, workspaceSecret, "PayrollEvents", Map.of("service", "payroll"))) {
 *
 *     shipper.postMessages(List.of("batch started", "batch finished"), null);
 *
 * } catch (HttpStatusException e) {
 *     // the batch is already queued for a background retry
 *     log.warn("Log Analytics rejected batch: {}", e.getStatusCode());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.loganalytics.api;
