/**
 * Plain socket adapters.
 */
package io.pandaproxy.infrastructure.net;
