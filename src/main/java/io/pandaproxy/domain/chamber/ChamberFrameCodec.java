package io.pandaproxy.domain.chamber;

import io.pandaproxy.validation.Numbers;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

/**
 * <strong>What:</strong> Encoder/decoder for the chamber image protocol spoken on printer port 6000.
 * <p><strong>Why:</strong> The proxy must be wire-identical to the printer toward clients and to a
 * regular client toward the printer, so both directions share this one codec.</p>
 * <p><strong>Wire format</strong> (all integers unsigned 32-bit little-endian):</p>
 * <ul>
 *   <li>Authentication, 80 bytes: {@code 0x40}, {@code 0x3000}, {@code 0}, {@code 0}, username
 *   (32 bytes, NUL padded), access code (32 bytes, NUL padded).</li>
 *   <li>Image frame: 16-byte header {@code [payloadLength, track, flags, reserved]} then
 *   {@code payloadLength} bytes of JPEG.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; decoding only moves the caller's buffer position.</p>
 * <p><strong>Performance:</strong> Decoding copies each frame exactly once into its wire image.</p>
 *
 * @since 0.1.0
 */
public final class ChamberFrameCodec {
  /** Total size of the authentication frame. */
  public static final int AUTH_FRAME_BYTES = 80;
  /** Size of the image frame header. */
  public static final int FRAME_HEADER_BYTES = 16;
  /** Default upper bound for a single image payload. */
  public static final int DEFAULT_MAX_FRAME_BYTES = 4 * 1024 * 1024;
  /** Lowest accepted value for the configurable payload bound. */
  public static final int MIN_MAX_FRAME_BYTES = 64 * 1024;
  /** Highest accepted value for the configurable payload bound. */
  public static final int MAX_MAX_FRAME_BYTES = 64 * 1024 * 1024;

  static final int AUTH_BODY_LENGTH = 0x40;
  static final int AUTH_COMMAND = 0x3000;
  private static final int USERNAME_OFFSET = 16;
  private static final int ACCESS_CODE_OFFSET = USERNAME_OFFSET + AccessCredential.FIELD_BYTES;

  private final int maxFrameBytes;

  /** Creates a codec bounded by {@link #DEFAULT_MAX_FRAME_BYTES}. */
  public ChamberFrameCodec() {
    this(DEFAULT_MAX_FRAME_BYTES);
  }

  /**
   * Creates a codec with an explicit payload bound.
   *
   * @param maxFrameBytes largest declared payload length accepted before the stream is deemed corrupt
   */
  public ChamberFrameCodec(int maxFrameBytes) {
    Numbers.requireRange("maxFrameBytes", maxFrameBytes, MIN_MAX_FRAME_BYTES, MAX_MAX_FRAME_BYTES);
    this.maxFrameBytes = maxFrameBytes;
  }

  public int maxFrameBytes() {
    return maxFrameBytes;
  }

  /**
   * Produces the fixed-length authentication frame for a credential.
   *
   * @param credential credential to present
   * @return 80-byte frame
   */
  public static byte[] encodeAuth(AccessCredential credential) {
    byte[] frame = new byte[AUTH_FRAME_BYTES];
    putIntLe(frame, 0, AUTH_BODY_LENGTH);
    putIntLe(frame, 4, AUTH_COMMAND);
    putIntLe(frame, 8, 0);
    putIntLe(frame, 12, 0);
    byte[] user = credential.usernameField();
    byte[] code = credential.accessCodeField();
    System.arraycopy(user, 0, frame, USERNAME_OFFSET, user.length);
    System.arraycopy(code, 0, frame, ACCESS_CODE_OFFSET, code.length);
    return frame;
  }

  /**
   * Decodes an authentication frame from the readable bytes of {@code buffer}.
   *
   * @param buffer source bytes between position and limit
   * @return the request, or empty when fewer than 80 bytes are available (position unchanged)
   * @throws FramingException if the header words are not those of an authentication frame, or a
   *     credential field carries non-zero bytes after its NUL terminator
   */
  public static Optional<AuthRequest> decodeAuth(ByteBuffer buffer) throws FramingException {
    if (buffer.remaining() < AUTH_FRAME_BYTES) {
      return Optional.empty();
    }
    int base = buffer.position();
    int length = getIntLe(buffer, base);
    int command = getIntLe(buffer, base + 4);
    int reserved1 = getIntLe(buffer, base + 8);
    int reserved2 = getIntLe(buffer, base + 12);
    if (length != AUTH_BODY_LENGTH || command != AUTH_COMMAND || reserved1 != 0 || reserved2 != 0) {
      throw new FramingException(String.format(
          "not an authentication frame (header %08x %08x %08x %08x)", length, command, reserved1, reserved2));
    }
    byte[] raw = new byte[AUTH_FRAME_BYTES];
    buffer.get(base, raw);
    byte[] user = stripPadding(raw, USERNAME_OFFSET, "username");
    byte[] code = stripPadding(raw, ACCESS_CODE_OFFSET, "access code");
    buffer.position(base + AUTH_FRAME_BYTES);
    return Optional.of(new AuthRequest(AccessCredential.fromWire(user, code)));
  }

  /**
   * Decodes one image frame from the readable bytes of {@code buffer}.
   *
   * @param buffer source bytes between position and limit
   * @return the frame, or empty when the header or payload is incomplete (position unchanged)
   * @throws FramingException if the declared payload length is zero or above {@link #maxFrameBytes()}
   */
  public Optional<Frame> decodeFrame(ByteBuffer buffer) throws FramingException {
    if (buffer.remaining() < FRAME_HEADER_BYTES) {
      return Optional.empty();
    }
    int base = buffer.position();
    long declared = getIntLe(buffer, base) & 0xFFFF_FFFFL;
    if (declared == 0 || declared > maxFrameBytes) {
      throw new FramingException(
          "implausible frame length " + declared + " (limit " + maxFrameBytes + ")");
    }
    int total = FRAME_HEADER_BYTES + (int) declared;
    if (buffer.remaining() < total) {
      return Optional.empty();
    }
    byte[] wire = new byte[total];
    buffer.get(wire);
    return Optional.of(new Frame(wire));
  }

  /**
   * Re-emits a frame exactly as it travels on the wire.
   *
   * @param frame frame to encode
   * @return header plus payload
   */
  public static byte[] encodeFrame(Frame frame) {
    return frame.toWireBytes();
  }

  private static byte[] stripPadding(byte[] raw, int offset, String field) throws FramingException {
    int end = offset;
    int limit = offset + AccessCredential.FIELD_BYTES;
    while (end < limit && raw[end] != 0) {
      end++;
    }
    for (int i = end; i < limit; i++) {
      if (raw[i] != 0) {
        throw new FramingException(field + " field has data after its NUL terminator");
      }
    }
    return Arrays.copyOfRange(raw, offset, end);
  }

  static int getIntLe(ByteBuffer buffer, int index) {
    return (buffer.get(index) & 0xFF)
        | (buffer.get(index + 1) & 0xFF) << 8
        | (buffer.get(index + 2) & 0xFF) << 16
        | (buffer.get(index + 3) & 0xFF) << 24;
  }

  static int getIntLe(byte[] bytes, int index) {
    return (bytes[index] & 0xFF)
        | (bytes[index + 1] & 0xFF) << 8
        | (bytes[index + 2] & 0xFF) << 16
        | (bytes[index + 3] & 0xFF) << 24;
  }

  static void putIntLe(byte[] bytes, int index, int value) {
    bytes[index] = (byte) value;
    bytes[index + 1] = (byte) (value >>> 8);
    bytes[index + 2] = (byte) (value >>> 16);
    bytes[index + 3] = (byte) (value >>> 24);
  }
}
