/**
 * The single printer connection: one session per attempt, supervised with capped exponential backoff.
 *
 * @since 0.1.0
 */
package io.pandaproxy.application.upstream;
