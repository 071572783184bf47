package com.codeheadsystems.secret;

import com.codeheadsystems.secret.hash.Hasher;
import com.codeheadsystems.secret.hash.Sha3Hasher;

/**
 * Settings applied to a secret at construction.
 *
 * @param hasher                     derives the secret's {@link com.codeheadsystems.secret.hash.HashedTag}
 * @param collectDestructionLocation whether {@code destroy()} records its caller
 */
public record SecretConfig(Hasher hasher, boolean collectDestructionLocation) {

  /**
   * SHA3 tags, destruction locations collected.
   */
  public static final SecretConfig DEFAULT = new SecretConfig(new Sha3Hasher(), true);

  /**
   * Returns a new config identical to this one but using the given {@link Hasher}.
   */
  public SecretConfig withHasher(Hasher hasher) {
    return new SecretConfig(hasher, collectDestructionLocation);
  }

  /**
   * Returns a new config identical to this one but with destruction location collection set.
   */
  public SecretConfig withCollectDestructionLocation(boolean collect) {
    return new SecretConfig(hasher, collect);
  }
}
