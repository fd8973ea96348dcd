/**
 * Metrics adapters that bridge the proxy's {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; instruments are created lazily and cached
 * per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code upstream.*}, {@code hub.*},
 * {@code client.*} and {@code events.*} namespaces.</p>
 * <p><strong>Security:</strong> Only counts and sizes are exported; never frame contents or
 * credentials.</p>
 */
package io.pandaproxy.infrastructure.metrics;
