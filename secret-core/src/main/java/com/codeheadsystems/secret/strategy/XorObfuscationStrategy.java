package com.codeheadsystems.secret.strategy;

import com.codeheadsystems.secret.buffer.KeyValueBuffer;
import com.codeheadsystems.secret.common.ByteUtils;
import com.codeheadsystems.secret.common.RandomProvider;
import java.util.function.Function;

/**
 * Default strategy: the value's byte form XOR a random key of the same length.
 * <p>
 * Intermediate byte arrays produced by the codecs are wiped before returning.
 *
 * @param <T> the value type
 */
public class XorObfuscationStrategy<T> implements ObfuscationStrategy<T> {

  private final Function<T, byte[]> toBytes;
  private final Function<byte[], T> fromBytes;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Xor obfuscation strategy.
   *
   * @param toBytes        encodes the value, the returned array is wiped after use
   * @param fromBytes      decodes the value, the given array is wiped after the call
   * @param randomProvider the source of key bytes
   */
  public XorObfuscationStrategy(final Function<T, byte[]> toBytes,
                                final Function<byte[], T> fromBytes,
                                final RandomProvider randomProvider) {
    this.toBytes = toBytes;
    this.fromBytes = fromBytes;
    this.randomProvider = randomProvider;
  }

  /**
   * Instantiates a new Xor obfuscation strategy with a default random provider.
   *
   * @param toBytes   the to bytes
   * @param fromBytes the from bytes
   */
  public XorObfuscationStrategy(final Function<T, byte[]> toBytes,
                                final Function<byte[], T> fromBytes) {
    this(toBytes, fromBytes, new RandomProvider());
  }

  @Override
  public KeyValueBuffer obfuscate(T value) {
    byte[] plain = toBytes.apply(value);
    try {
      return KeyValueBuffer.obfuscate(plain, randomProvider);
    } finally {
      ByteUtils.wipe(plain);
    }
  }

  @Override
  public T deObfuscate(KeyValueBuffer buffer) {
    byte[] plain = buffer.reveal();
    try {
      return fromBytes.apply(plain);
    } finally {
      ByteUtils.wipe(plain);
    }
  }

  /**
   * Same codecs, different random source.
   *
   * @param randomProvider the random provider
   * @return the xor obfuscation strategy
   */
  public XorObfuscationStrategy<T> withRandomProvider(RandomProvider randomProvider) {
    return new XorObfuscationStrategy<>(toBytes, fromBytes, randomProvider);
  }
}
