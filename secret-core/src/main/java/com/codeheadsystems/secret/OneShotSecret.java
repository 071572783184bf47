package com.codeheadsystems.secret;

import com.codeheadsystems.secret.effect.SecretEffect;
import com.codeheadsystems.secret.strategy.ObfuscationStrategy;
import com.codeheadsystems.secret.strategy.ObfuscationStrategyRegistry;
import java.util.function.Function;

/**
 * A secret that can be read once. Every {@code use} destroys it after the callback completes,
 * whether the callback succeeded or not. {@link #isEquals(SecretApi)} does not count as a read.
 *
 * @param <T> the value type
 */
public final class OneShotSecret<T> extends SecretApi<T> {

  private OneShotSecret(final T value, final ObfuscationStrategy<T> strategy, final SecretConfig config) {
    super(value, strategy, config);
  }

  /**
   * Create a one-shot secret using the default strategy for the value's class.
   *
   * @param value the value
   * @param <T>   the value type
   * @return the one shot secret
   * @throws IllegalArgumentException if no default strategy exists for the value's class
   */
  public static <T> OneShotSecret<T> of(T value) {
    return of(value, ObfuscationStrategyRegistry.DEFAULT.forValue(value));
  }

  public static <T> OneShotSecret<T> of(T value, ObfuscationStrategy<T> strategy) {
    return of(value, strategy, SecretConfig.DEFAULT);
  }

  public static <T> OneShotSecret<T> of(T value, ObfuscationStrategy<T> strategy, SecretConfig config) {
    return new OneShotSecret<>(value, strategy, config);
  }

  @Override
  public <R, U> R evalUse(SecretEffect<R, U> effect, Function<T, R> f) {
    if (isDestroyed()) {
      return noLongerValid(effect);
    }
    return effect.guarantee(() -> f.apply(reveal()), destroyLater());
  }
}
