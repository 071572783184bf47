package com.codeheadsystems.secret.buffer;

import com.codeheadsystems.secret.common.ByteUtils;
import com.codeheadsystems.secret.common.RandomProvider;
import java.nio.ByteBuffer;

/**
 * The key and value buffers backing a single secret.
 * <p>
 * Both buffers are allocated off-heap with identical length. The key holds random bytes and the
 * value holds {@code plain XOR key}, so neither buffer alone contains the plaintext. The pair is
 * owned by exactly one secret and is never shared.
 * <p>
 * {@link #destroy()} zero-fills both buffers and releases them to the garbage collector. Zeroing is
 * deterministic; reclamation of the direct memory is not. Copies the JVM made on its own (string
 * interning, JIT temporaries, copying collectors) cannot be reached from here.
 */
public final class KeyValueBuffer {

  private final int length;
  private ByteBuffer key;
  private ByteBuffer value;

  private KeyValueBuffer(ByteBuffer key, ByteBuffer value, int length) {
    this.key = key;
    this.value = value;
    this.length = length;
  }

  /**
   * Allocates a pair of {@code length} bytes. The key is filled from the random provider, the value
   * is all zeros.
   *
   * @param length         the length of both buffers
   * @param randomProvider the source of key bytes
   * @return the key value buffer
   */
  public static KeyValueBuffer allocate(int length, RandomProvider randomProvider) {
    if (length < 0) {
      throw new IllegalArgumentException("Buffer length must not be negative: " + length);
    }
    ByteBuffer key = ByteBuffer.allocateDirect(length);
    ByteBuffer value = ByteBuffer.allocateDirect(length);
    for (int i = 0; i < length; i += 64) {
      byte[] chunk = randomProvider.randomBytes(Math.min(64, length - i));
      key.put(i, chunk);
      ByteUtils.wipe(chunk);
    }
    return new KeyValueBuffer(key, value, length);
  }

  /**
   * Allocates a pair sized for {@code plain} and stores it masked with a fresh key. The caller keeps
   * ownership of {@code plain} and is responsible for scrubbing it.
   *
   * @param plain          the plain bytes
   * @param randomProvider the source of key bytes
   * @return the key value buffer
   */
  public static KeyValueBuffer obfuscate(byte[] plain, RandomProvider randomProvider) {
    KeyValueBuffer buffer = allocate(plain.length, randomProvider);
    byte[] key = buffer.copy(buffer.key);
    byte[] masked = ByteUtils.xor(plain, key);
    buffer.value.put(0, masked);
    ByteUtils.wipe(key, masked);
    return buffer;
  }

  /**
   * Recovers the plain bytes into a new heap array. The caller must scrub the result once done.
   *
   * @return the plain bytes
   */
  public byte[] reveal() {
    requireLive();
    byte[] keyBytes = copy(key);
    byte[] masked = copy(value);
    try {
      return ByteUtils.xor(masked, keyBytes);
    } finally {
      ByteUtils.wipe(keyBytes, masked);
    }
  }

  /**
   * Hash of the obfuscated value bytes. Never the hash of the plaintext and never negative.
   *
   * @return the hash
   */
  public int obfuscatedHashCode() {
    requireLive();
    int h = 1;
    for (int i = 0; i < length; i++) {
      h = 31 * h + value.get(i);
    }
    return h & Integer.MAX_VALUE;
  }

  /**
   * Zero-fills both buffers and drops them. Calling this more than once has no effect.
   */
  public void destroy() {
    if (isDestroyed()) {
      return;
    }
    for (int i = 0; i < length; i++) {
      key.put(i, (byte) 0);
      value.put(i, (byte) 0);
    }
    key = null;
    value = null;
  }

  public boolean isDestroyed() {
    return key == null;
  }

  public int length() {
    return length;
  }

  private byte[] copy(ByteBuffer source) {
    byte[] out = new byte[length];
    source.get(0, out);
    return out;
  }

  private void requireLive() {
    if (isDestroyed()) {
      throw new IllegalStateException("Buffer has been destroyed");
    }
  }

  @Override
  public String toString() {
    return "KeyValueBuffer[length=" + length + ", destroyed=" + isDestroyed() + "]";
  }
}
