/**
 * Configuration loading, merging, and wiring.
 * <p>Sources are merged with precedence CLI {@code key=value} &gt; environment
 * ({@code PRINTER_IP}, {@code ACCESS_CODE}, {@code BIND_ADDRESS}) &gt; YAML &gt; built-in defaults,
 * then validated once into a {@link io.pandaproxy.config.ProxyConfig}. Configuration is read at
 * startup only.</p>
 * <p>{@link io.pandaproxy.config.CompositionRoot} turns the validated record into runnable use cases.</p>
 *
 * @since 0.1.0
 */
package io.pandaproxy.config;
