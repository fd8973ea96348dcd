/**
 * Thread and executor factories for connection workers.
 * <p><strong>Concurrency:</strong> Every thread is a named, non-daemon platform thread running
 * blocking socket I/O; names follow {@code chamber-upstream}, {@code chamber-accept},
 * {@code chamber-client-N} and {@code ftp-forward-N}.</p>
 * <p><strong>Security:</strong> Thread names never carry peer credentials.</p>
 */
package io.pandaproxy.infrastructure.exec;
