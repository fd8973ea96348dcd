/**
 * TLS plumbing for both sides of the proxy.
 * <p>The printer presents a self-signed certificate, so the upstream side trusts any chain and
 * skips host name checks. The client-facing listener uses operator-supplied key material.</p>
 */
package io.pandaproxy.infrastructure.tls;
