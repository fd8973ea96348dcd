package io.pandaproxy.domain.chamber;

import java.util.Objects;

/**
 * Authentication frame presented by a peer before any image data flows.
 *
 * @param credential credential carried in the frame
 * @since 0.1.0
 */
public record AuthRequest(AccessCredential credential) {

  public AuthRequest {
    Objects.requireNonNull(credential, "credential");
  }

  /**
   * Checks whether this request carries exactly the expected credential.
   *
   * @param expected configured credential
   * @return {@code true} on an exact byte-for-byte match of username and access code
   */
  public boolean accepts(AccessCredential expected) {
    return credential.matches(expected);
  }
}
