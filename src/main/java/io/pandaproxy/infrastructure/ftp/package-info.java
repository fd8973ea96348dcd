/**
 * Optional FTPS passthrough so single-address clients can upload print files through the proxy.
 * <p>Threads are named {@code ftp-accept-<port>} and {@code ftp-forward-N}.</p>
 */
package io.pandaproxy.infrastructure.ftp;
