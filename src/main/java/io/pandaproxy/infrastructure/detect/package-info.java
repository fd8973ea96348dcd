/**
 * Camera protocol detection by TLS probing.
 * <p>Detection runs once at startup; its answer picks between the chamber image proxy and the
 * RTSP relay.</p>
 */
package io.pandaproxy.infrastructure.detect;
