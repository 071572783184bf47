package com.codeheadsystems.secret.jackson;

/**
 * What a secret is written as.
 */
public enum TagMode {
  /**
   * The fixed {@link com.codeheadsystems.secret.SecretApi#PLACEHOLDER}.
   */
  PLACEHOLDER,
  /**
   * The secret's {@link com.codeheadsystems.secret.hash.HashedTag}, comparable across systems.
   */
  HASHED
}
