package com.codeheadsystems.secret.strategy;

import com.codeheadsystems.secret.buffer.KeyValueBuffer;

/**
 * Converts a value of type {@code T} to and from its obfuscated {@link KeyValueBuffer}.
 * <p>
 * Implementations are stateless and shared between secrets. For every value {@code v},
 * {@code deObfuscate(obfuscate(v))} must equal {@code v}. Implementations should not keep any copy
 * of the value's bytes once {@link #obfuscate} returns.
 *
 * @param <T> the value type
 */
public interface ObfuscationStrategy<T> {

  /**
   * Obfuscate the value into a freshly allocated buffer.
   *
   * @param value the value
   * @return the key value buffer
   */
  KeyValueBuffer obfuscate(T value);

  /**
   * Rebuild the value from a live buffer. Behaviour on a destroyed buffer is undefined; secrets
   * never call this after destruction.
   *
   * @param buffer the buffer
   * @return the value
   */
  T deObfuscate(KeyValueBuffer buffer);
}
