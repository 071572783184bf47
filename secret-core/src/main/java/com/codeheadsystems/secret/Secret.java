package com.codeheadsystems.secret;

import com.codeheadsystems.secret.effect.SecretEffect;
import com.codeheadsystems.secret.strategy.ObfuscationStrategy;
import com.codeheadsystems.secret.strategy.ObfuscationStrategyRegistry;
import java.util.function.Function;

/**
 * A secret that stays readable until {@link #destroy()} is called.
 *
 * <pre>{@code
 * Secret<String> password = Secret.of("my_password");
 * SecretResult<Connection> connection = password.useE(pwd -> dataSource.connect(user, pwd));
 * }</pre>
 *
 * @param <T> the value type
 */
public final class Secret<T> extends SecretApi<T> {

  private Secret(final T value, final ObfuscationStrategy<T> strategy, final SecretConfig config) {
    super(value, strategy, config);
  }

  /**
   * Create a secret using the default strategy for the value's class.
   *
   * @param value the value
   * @param <T>   the value type
   * @return the secret
   * @throws IllegalArgumentException if no default strategy exists for the value's class
   */
  public static <T> Secret<T> of(T value) {
    return of(value, ObfuscationStrategyRegistry.DEFAULT.forValue(value));
  }

  public static <T> Secret<T> of(T value, ObfuscationStrategy<T> strategy) {
    return of(value, strategy, SecretConfig.DEFAULT);
  }

  public static <T> Secret<T> of(T value, ObfuscationStrategy<T> strategy, SecretConfig config) {
    return new Secret<>(value, strategy, config);
  }

  @Override
  public <R, U> R evalUse(SecretEffect<R, U> effect, Function<T, R> f) {
    if (isDestroyed()) {
      return noLongerValid(effect);
    }
    return effect.defer(() -> f.apply(reveal()));
  }
}
