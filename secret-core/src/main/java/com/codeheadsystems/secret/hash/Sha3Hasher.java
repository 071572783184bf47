package com.codeheadsystems.secret.hash;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA3Digest;
import org.bouncycastle.util.encoders.Hex;

/**
 * SHA3-256 over a domain separator followed by the input. Fast; fine for high-entropy values such
 * as tokens and keys. Use {@link Argon2Hasher} when tags of low-entropy passwords may leak.
 */
public class Sha3Hasher implements Hasher {

  public static final String ALGORITHM = "sha3-256";
  public static final byte[] DEFAULT_DOMAIN = "secret-tag-v1".getBytes(StandardCharsets.UTF_8);

  private final byte[] domain;

  /**
   * Instantiates a new Sha3 hasher with the default domain separator.
   */
  public Sha3Hasher() {
    this(DEFAULT_DOMAIN);
  }

  /**
   * Instantiates a new Sha3 hasher.
   *
   * @param domain the domain separator, hashed ahead of every input
   */
  public Sha3Hasher(byte[] domain) {
    this.domain = domain.clone();
  }

  @Override
  public HashedTag hash(byte[] input) {
    SHA3Digest digest = new SHA3Digest(256);
    digest.update(domain, 0, domain.length);
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return new HashedTag(ALGORITHM, Hex.toHexString(out));
  }
}
