package io.pandaproxy.domain.chamber;

import io.pandaproxy.validation.Strings;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;

/**
 * Printer identity and shared access code used on both sides of the chamber image handshake.
 * <p>Immutable. Both fields are ASCII byte strings no wider than {@link #FIELD_BYTES}. The access
 * code never appears in {@link #toString()}.</p>
 *
 * @since 0.1.0
 */
public final class AccessCredential {
  /** Width of the username and access-code fields inside the authentication frame. */
  public static final int FIELD_BYTES = 32;
  /** Service account name used by the printer firmware. */
  public static final String DEFAULT_USERNAME = "bblp";

  private final byte[] username;
  private final byte[] accessCode;

  private AccessCredential(byte[] username, byte[] accessCode) {
    this.username = username;
    this.accessCode = accessCode;
  }

  /**
   * Creates a credential for the printer's fixed service account.
   *
   * @param accessCode printer access code; printable ASCII, 1..32 characters
   * @return credential
   * @throws IllegalArgumentException if the code is blank, non-ASCII, or too wide
   */
  public static AccessCredential forAccessCode(String accessCode) {
    return of(DEFAULT_USERNAME, accessCode);
  }

  /**
   * Creates a credential from explicit username and access code.
   *
   * @param username service account name; printable ASCII, 1..32 characters
   * @param accessCode access code; printable ASCII, 1..32 characters
   * @return credential
   */
  public static AccessCredential of(String username, String accessCode) {
    return new AccessCredential(
        Strings.requireAsciiField("username", username, FIELD_BYTES),
        Strings.requireAsciiField("accessCode", accessCode, FIELD_BYTES));
  }

  /**
   * Creates a credential from raw field bytes as decoded off the wire (NUL padding already stripped).
   *
   * @param username username bytes, at most 32
   * @param accessCode access code bytes, at most 32
   * @return credential holding private copies of the arrays
   */
  static AccessCredential fromWire(byte[] username, byte[] accessCode) {
    if (username.length > FIELD_BYTES || accessCode.length > FIELD_BYTES) {
      throw new IllegalArgumentException("credential fields must be at most " + FIELD_BYTES + " bytes");
    }
    return new AccessCredential(username.clone(), accessCode.clone());
  }

  /** @return copy of the username bytes */
  public byte[] username() {
    return username.clone();
  }

  /** @return copy of the access code bytes */
  public byte[] accessCode() {
    return accessCode.clone();
  }

  /**
   * Compares both fields in constant time with respect to their contents.
   *
   * @param other credential presented by a peer; {@code null} never matches
   * @return {@code true} when username and access code are byte-for-byte equal
   */
  public boolean matches(AccessCredential other) {
    if (other == null) {
      return false;
    }
    boolean userOk = MessageDigest.isEqual(username, other.username);
    boolean codeOk = MessageDigest.isEqual(accessCode, other.accessCode);
    return userOk & codeOk;
  }

  byte[] usernameField() {
    return username;
  }

  byte[] accessCodeField() {
    return accessCode;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof AccessCredential that && matches(that);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(username) + Arrays.hashCode(accessCode);
  }

  @Override
  public String toString() {
    return "AccessCredential[username="
        + new String(username, StandardCharsets.US_ASCII)
        + ", accessCode=[REDACTED]]";
  }
}
