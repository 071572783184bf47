package com.codeheadsystems.secret.hash;

/**
 * Deterministic, non-reversible stand-in for a plaintext value. Safe to log or serialize.
 *
 * @param algorithm the hasher that produced the digest
 * @param digest    the hex-encoded digest
 */
public record HashedTag(String algorithm, String digest) {

  @Override
  public String toString() {
    return algorithm + ":" + digest;
  }
}
