/**
 * Logging helpers shared by the CLI and the connection threads.
 *
 * @since 0.1.0
 */
package io.pandaproxy.logging;
