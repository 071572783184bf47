package com.codeheadsystems.secret;

import java.util.Optional;

/**
 * Raised when a destroyed secret is accessed.
 */
public class SecretNoLongerValidException extends RuntimeException {

  private final transient DestructionLocation destructionLocation;

  /**
   * Instantiates a new Secret no longer valid exception.
   *
   * @param destructionLocation where the secret was destroyed, null when not collected
   */
  public SecretNoLongerValidException(final DestructionLocation destructionLocation) {
    super(destructionLocation == null
        ? "This secret value is no longer valid"
        : "This secret value is no longer valid, it was destroyed at " + destructionLocation);
    this.destructionLocation = destructionLocation;
  }

  public Optional<DestructionLocation> destructionLocation() {
    return Optional.ofNullable(destructionLocation);
  }
}
