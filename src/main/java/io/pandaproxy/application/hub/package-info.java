/**
 * Fan-out of upstream frames to per-client bounded outboxes.
 * <p>Publishing never blocks on a client: a full outbox drops its oldest frame.</p>
 */
package io.pandaproxy.application.hub;
