/**
 * Lifecycle event adapters.
 */
package io.pandaproxy.infrastructure.events;
