/**
 * <strong>Purpose:</strong> Ports between the proxy's use cases and its transports, clock, metrics and events.
 * <p><strong>Pipeline role:</strong> Application layer; {@code infrastructure} adapters implement these
 * interfaces and tests substitute plain sockets or recording doubles.</p>
 * <p><strong>Concurrency:</strong> {@link io.pandaproxy.application.port.MetricsPort} and
 * {@link io.pandaproxy.application.port.ProxyEventEmitter} are called from every connection thread
 * and must be thread-safe.</p>
 *
 * @since 0.1.0
 */
package io.pandaproxy.application.port;
