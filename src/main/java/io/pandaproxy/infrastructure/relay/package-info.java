/**
 * RTSP relay adapters.
 */
package io.pandaproxy.infrastructure.relay;
