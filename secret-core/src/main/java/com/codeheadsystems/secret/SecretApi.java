package com.codeheadsystems.secret;

import com.codeheadsystems.secret.buffer.KeyValueBuffer;
import com.codeheadsystems.secret.common.ByteUtils;
import com.codeheadsystems.secret.effect.SecretEffect;
import com.codeheadsystems.secret.effect.SecretEffects;
import com.codeheadsystems.secret.effect.SecretResult;
import com.codeheadsystems.secret.hash.HashedTag;
import com.codeheadsystems.secret.strategy.ObfuscationStrategy;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common behaviour of {@link Secret} and {@link OneShotSecret}.
 * <p>
 * The value is obfuscated by its {@link ObfuscationStrategy} when the secret is created and is only
 * de-obfuscated for the duration of a single {@code use} callback. A secret is either valid or
 * destroyed; destruction zero-fills the backing buffer and cannot be undone. Every access to a
 * destroyed secret fails with {@link SecretNoLongerValidException}, wrapped in the caller's
 * {@link SecretEffect}.
 * <p>
 * The class does its best to keep the value out of logs and memory, but it is obfuscation, not
 * encryption. If a callback suspends while holding the value (for example a deferred future), the
 * plaintext stays in ordinary heap memory until it completes.
 * <p>
 * Secrets are not thread safe. Concurrent {@code destroy} and {@code use} calls on the same secret
 * must be serialized by the caller.
 *
 * @param <T> the value type
 */
public abstract class SecretApi<T> implements AutoCloseable {

  /**
   * Returned by {@link #toString()} in place of the value.
   */
  public static final String PLACEHOLDER = "** SECRET **";

  private static final Logger log = LoggerFactory.getLogger(SecretApi.class);

  private final ObfuscationStrategy<T> strategy;
  private final HashedTag hashed;
  private final boolean collectDestructionLocation;
  private KeyValueBuffer buffer;
  private DestructionLocation destructionLocation;

  SecretApi(final T value, final ObfuscationStrategy<T> strategy, final SecretConfig config) {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(strategy, "strategy");
    Objects.requireNonNull(config, "config");
    this.strategy = strategy;
    this.collectDestructionLocation = config.collectDestructionLocation();
    this.hashed = config.hasher().hashValue(value);
    this.buffer = strategy.obfuscate(value);
  }

  /**
   * Apply {@code f} to the de-obfuscated value. A destroyed secret raises
   * {@link SecretNoLongerValidException} through the effect without calling {@code f}.
   *
   * @param effect the effect
   * @param f      the function
   * @param <R>    the effect type
   * @param <U>    the carried value type
   * @return the result of {@code f}
   */
  public abstract <R, U> R evalUse(SecretEffect<R, U> effect, Function<T, R> f);

  /**
   * Apply {@code f} to the de-obfuscated value, lifting its result into the effect.
   *
   * @param effect the effect
   * @param f      the function
   * @param <R>    the effect type
   * @param <U>    the result type
   * @return the effect
   */
  public final <R, U> R use(SecretEffect<R, U> effect, Function<T, U> f) {
    return evalUse(effect, value -> effect.pure(f.apply(value)));
  }

  /**
   * {@link #use} with {@link SecretResult}.
   */
  public final <U> SecretResult<U> useE(Function<T, U> f) {
    return use(SecretEffects.result(), f);
  }

  /**
   * Avoid this method if possible. Applies {@code f} and returns its plain result.
   *
   * @throws SecretNoLongerValidException if the secret is destroyed
   */
  public final <U> U unsafeUse(Function<T, U> f) {
    return use(SecretEffects.unsafe(), f);
  }

  /**
   * Apply {@code f} to the de-obfuscated value and destroy the secret once {@code f} completes,
   * whether it succeeded or not.
   *
   * @param effect the effect
   * @param f      the function
   * @param <R>    the effect type
   * @param <U>    the carried value type
   * @return the result of {@code f}
   */
  public final <R, U> R evalUseAndDestroy(SecretEffect<R, U> effect, Function<T, R> f) {
    if (isDestroyed()) {
      return noLongerValid(effect);
    }
    return effect.guarantee(() -> evalUse(effect, f), destroyLater());
  }

  /**
   * Pure variant of {@link #evalUseAndDestroy}.
   */
  public final <R, U> R useAndDestroy(SecretEffect<R, U> effect, Function<T, U> f) {
    return evalUseAndDestroy(effect, value -> effect.pure(f.apply(value)));
  }

  /**
   * {@link #useAndDestroy} with {@link SecretResult}.
   */
  public final <U> SecretResult<U> useAndDestroyE(Function<T, U> f) {
    return useAndDestroy(SecretEffects.result(), f);
  }

  /**
   * Avoid this method if possible. Applies {@code f}, destroys the secret and returns the plain result.
   *
   * @throws SecretNoLongerValidException if the secret is destroyed
   */
  public final <U> U unsafeUseAndDestroy(Function<T, U> f) {
    return useAndDestroy(SecretEffects.unsafe(), f);
  }

  /**
   * Zero-fill and release the obfuscated value. Idempotent.
   */
  public final void destroy() {
    if (!isDestroyed()) {
      destroyAt(locate());
    }
  }

  public final boolean isDestroyed() {
    return buffer == null;
  }

  /**
   * Where this secret was destroyed, if it is destroyed and location collection is enabled.
   *
   * @return the destruction location
   */
  public final Optional<DestructionLocation> destructionLocation() {
    return Optional.ofNullable(destructionLocation);
  }

  /**
   * The deterministic tag of the value, computed when the secret was created. Remains available
   * after destruction.
   *
   * @return the hashed tag
   */
  public final HashedTag hashed() {
    return hashed;
  }

  /**
   * Compare the values of two secrets without destroying either.
   *
   * @param that the other secret
   * @return {@code true} if both are valid and hold equal values, {@code false} otherwise
   */
  public final boolean isEquals(SecretApi<T> that) {
    if (that == null || isDestroyed() || that.isDestroyed()) {
      return false;
    }
    T mine = null;
    T theirs = null;
    try {
      mine = reveal();
      theirs = that.reveal();
      return Objects.deepEquals(mine, theirs);
    } catch (RuntimeException e) {
      log.debug("isEquals(): comparison failed: {}", e.getClass().getSimpleName());
      return false;
    } finally {
      scrub(mine);
      scrub(theirs);
    }
  }

  /**
   * Alias for {@link #destroy()}.
   */
  @Override
  public final void close() {
    destroy();
  }

  /**
   * Hash of the obfuscated bytes, not of the value. The key is random per secret, so two secrets
   * holding equal values hash differently.
   *
   * @return the hash, or {@code -1} once destroyed
   */
  @Override
  public final int hashCode() {
    return isDestroyed() ? -1 : buffer.obfuscatedHashCode();
  }

  /**
   * Always {@code false}, even for the same instance. Use {@link #isEquals(SecretApi)}.
   */
  @Override
  public final boolean equals(Object obj) {
    return false;
  }

  /**
   * Always {@link #PLACEHOLDER}.
   */
  @Override
  public final String toString() {
    return PLACEHOLDER;
  }

  /**
   * De-obfuscate the value. Callers check {@link #isDestroyed()} first.
   */
  final T reveal() {
    return strategy.deObfuscate(buffer);
  }

  /**
   * A finalizer destroying this secret. The destruction location is the caller scheduling it, not
   * the thread that later completes a deferred use.
   */
  final Runnable destroyLater() {
    final DestructionLocation location = locate();
    return () -> destroyAt(location);
  }

  private DestructionLocation locate() {
    return collectDestructionLocation ? DestructionLocation.capture().orElse(null) : null;
  }

  private void destroyAt(final DestructionLocation location) {
    if (buffer == null) {
      return;
    }
    buffer.destroy();
    buffer = null;
    destructionLocation = location;
    log.debug("Secret destroyed at {}", destructionLocation);
  }

  private static void scrub(Object value) {
    if (value instanceof byte[] bytes) {
      ByteUtils.wipe(bytes);
    } else if (value instanceof char[] chars) {
      ByteUtils.wipe(chars);
    }
  }

  final <R, U> R noLongerValid(SecretEffect<R, U> effect) {
    return effect.raiseError(new SecretNoLongerValidException(destructionLocation));
  }
}
