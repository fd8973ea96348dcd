/**
 * <strong>Purpose:</strong> The chamber image wire protocol: the 80-byte authentication frame, the
 * 16-byte image header, and the failures each can raise.
 * <p>All integers are little-endian unsigned 32-bit words. Codecs here are pure and perform no I/O
 * beyond the streams handed to them.</p>
 * <p><strong>Security:</strong> {@link io.pandaproxy.domain.chamber.AccessCredential} never renders
 * the access code in {@code toString}.</p>
 *
 * @since 0.1.0
 */
package io.pandaproxy.domain.chamber;
