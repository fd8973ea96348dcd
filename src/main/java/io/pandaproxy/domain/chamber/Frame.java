package io.pandaproxy.domain.chamber;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * One complete camera image as delimited by the chamber image framing.
 * <p>The header and payload are held as a single immutable wire image that is built once and written
 * unchanged to every client. Nothing exposes the backing array.</p>
 *
 * @since 0.1.0
 */
public final class Frame {
  private final byte[] wire;

  Frame(byte[] wire) {
    this.wire = wire;
  }

  /**
   * Builds a frame with the given header words and payload.
   *
   * @param track header word at offset 4 (the firmware sends 0)
   * @param flags header word at offset 8 (the firmware sends 1)
   * @param payload image bytes; must not be empty
   * @return frame owning a private copy of the payload
   */
  public static Frame of(int track, int flags, byte[] payload) {
    Objects.requireNonNull(payload, "payload");
    if (payload.length == 0) {
      throw new IllegalArgumentException("payload must not be empty");
    }
    byte[] wire = new byte[ChamberFrameCodec.FRAME_HEADER_BYTES + payload.length];
    ChamberFrameCodec.putIntLe(wire, 0, payload.length);
    ChamberFrameCodec.putIntLe(wire, 4, track);
    ChamberFrameCodec.putIntLe(wire, 8, flags);
    ChamberFrameCodec.putIntLe(wire, 12, 0);
    System.arraycopy(payload, 0, wire, ChamberFrameCodec.FRAME_HEADER_BYTES, payload.length);
    return new Frame(wire);
  }

  /**
   * Builds a frame with the header words the printer firmware emits.
   *
   * @param payload JPEG bytes
   * @return frame
   */
  public static Frame ofJpeg(byte[] payload) {
    return of(0, 1, payload);
  }

  public int payloadLength() {
    return ChamberFrameCodec.getIntLe(wire, 0);
  }

  public int track() {
    return ChamberFrameCodec.getIntLe(wire, 4);
  }

  public int flags() {
    return ChamberFrameCodec.getIntLe(wire, 8);
  }

  /** @return total bytes written to a client for this frame (header plus payload) */
  public int wireLength() {
    return wire.length;
  }

  /** @return copy of the image bytes */
  public byte[] payload() {
    return Arrays.copyOfRange(wire, ChamberFrameCodec.FRAME_HEADER_BYTES, wire.length);
  }

  /** @return copy of the full wire image */
  public byte[] toWireBytes() {
    return wire.clone();
  }

  /**
   * Writes the header and payload to a client stream without copying.
   *
   * @param out destination stream
   * @throws IOException if the write fails
   */
  public void writeTo(OutputStream out) throws IOException {
    out.write(wire, 0, wire.length);
  }

  @Override
  public String toString() {
    return "Frame[payloadLength=" + payloadLength() + ", track=" + track() + ", flags=" + flags() + ']';
  }
}
