package io.pandaproxy.config;

import io.pandaproxy.application.client.ClientSession;
import io.pandaproxy.application.hub.FanOutHub;
import io.pandaproxy.application.pipeline.ChamberProxyUseCase;
import io.pandaproxy.application.port.ClockPort;
import io.pandaproxy.application.port.ListenerFactory;
import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.application.port.ProtocolDetector;
import io.pandaproxy.application.port.ProxyEventEmitter;
import io.pandaproxy.application.port.RelayLauncher;
import io.pandaproxy.application.port.Sleeper;
import io.pandaproxy.application.port.UpstreamConnector;
import io.pandaproxy.application.upstream.BackoffPolicy;
import io.pandaproxy.application.upstream.ReconnectSupervisor;
import io.pandaproxy.application.upstream.UpstreamSession;
import io.pandaproxy.domain.chamber.AccessCredential;
import io.pandaproxy.domain.chamber.ChamberFrameCodec;
import io.pandaproxy.infrastructure.detect.TlsProbeProtocolDetector;
import io.pandaproxy.infrastructure.events.LoggingProxyEventEmitter;
import io.pandaproxy.infrastructure.ftp.FtpPassthroughProxy;
import io.pandaproxy.infrastructure.net.PlainListenerFactory;
import io.pandaproxy.infrastructure.relay.UnavailableRelayLauncher;
import io.pandaproxy.infrastructure.tls.TlsContexts;
import io.pandaproxy.infrastructure.tls.TlsListenerFactory;
import io.pandaproxy.infrastructure.tls.TlsUpstreamConnector;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Objects;
import java.util.function.Supplier;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;

/**
 * <strong>What:</strong> Wires the proxy's use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps construction in one place so the CLI only decides what to run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build exactly one hub and one upstream supervisor per chamber proxy.</li>
 *   <li>Create TLS contexts for the printer side and, when serving, the client side.</li>
 *   <li>Expose the detector, FTP passthrough and relay launcher for the CLI's dispatch.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use from the CLI thread only.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final ProxyConfig config;
  private final MetricsPort metrics;
  private final ProxyEventEmitter events;
  private final ClockPort clock;

  /**
   * @param config validated proxy configuration
   * @param metrics metrics sink shared by every component
   */
  public CompositionRoot(ProxyConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.events = new LoggingProxyEventEmitter(metrics);
    this.clock = ClockPort.SYSTEM;
  }

  public ProxyConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ProxyEventEmitter events() {
    return events;
  }

  /**
   * @return detector probing the configured chamber and RTSP ports
   * @throws GeneralSecurityException if no TLS implementation is available
   */
  public ProtocolDetector protocolDetector() throws GeneralSecurityException {
    return TlsProbeProtocolDetector.forPorts(
        config.chamberPort(), config.rtspPort(), config.detectTimeout(), printerSocketFactory());
  }

  /**
   * Builds the chamber image proxy with its TLS listener and upstream supervisor.
   *
   * @return proxy, not yet started
   * @throws IOException if the listener keystore cannot be read
   * @throws GeneralSecurityException if the keystore or TLS setup is invalid
   * @throws IllegalArgumentException if no listener keystore is configured
   */
  public ChamberProxyUseCase chamberProxyUseCase() throws IOException, GeneralSecurityException {
    Path keystore = config.tlsKeystore();
    if (keystore == null) {
      throw new IllegalArgumentException(
          "tlsKeystore is required to serve clients (PKCS12 file with the listener certificate)");
    }
    if (!Files.isReadable(keystore)) {
      throw new IllegalArgumentException("tlsKeystore is not readable: " + keystore);
    }
    SSLContext listenerContext =
        TlsContexts.listener(keystore, config.tlsKeystorePassword().toCharArray());
    ListenerFactory listeners = new TlsListenerFactory(listenerContext.getServerSocketFactory());
    UpstreamConnector connector = new TlsUpstreamConnector(
        config.printerIp(), config.chamberPort(), config.connectTimeout(), printerSocketFactory());
    return chamberProxyUseCase(listeners, connector, Sleeper.THREAD);
  }

  /**
   * Builds the chamber image proxy over caller-supplied transports.
   *
   * @param listeners client-facing listener factory
   * @param connector printer connector
   * @param sleeper backoff sleeper
   * @return proxy, not yet started
   */
  public ChamberProxyUseCase chamberProxyUseCase(
      ListenerFactory listeners, UpstreamConnector connector, Sleeper sleeper) {
    AccessCredential credential = config.credential();
    ChamberFrameCodec codec = new ChamberFrameCodec(config.maxFrameBytes());
    FanOutHub hub = new FanOutHub(metrics);
    Supplier<UpstreamSession> sessions = () -> new UpstreamSession(
        connector, credential, codec, config.authTimeout(), config.idleTimeout(), metrics);
    ReconnectSupervisor supervisor = new ReconnectSupervisor(
        sessions,
        hub,
        new BackoffPolicy(config.backoffMin(), config.backoffMax()),
        sleeper,
        events,
        clock,
        metrics);
    return new ChamberProxyUseCase(
        listeners,
        config.bind(),
        config.proxyPort(),
        credential,
        hub,
        supervisor,
        new ClientSession.Settings(config.clientAuthTimeout(), config.clientQueueFrames()),
        events,
        clock,
        metrics);
  }

  /** @return FTPS passthrough on the printer's standard ports */
  public FtpPassthroughProxy ftpPassthrough() {
    return FtpPassthroughProxy.standard(new PlainListenerFactory(), config.bind(), config.printerIp());
  }

  public RelayLauncher relayLauncher() {
    return new UnavailableRelayLauncher();
  }

  private static SSLSocketFactory printerSocketFactory() throws GeneralSecurityException {
    return TlsContexts.printerClient().getSocketFactory();
  }
}
