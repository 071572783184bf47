package com.codeheadsystems.secret.effect;

import com.codeheadsystems.secret.SecretNoLongerValidException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Synchronous result of a secret access: either the value or the
 * {@link SecretNoLongerValidException} raised because the secret was destroyed.
 *
 * @param <U> the value type
 */
public sealed interface SecretResult<U> permits SecretResult.Success, SecretResult.Failure {

  static <U> SecretResult<U> success(U value) {
    return new Success<>(value);
  }

  static <U> SecretResult<U> failure(SecretNoLongerValidException error) {
    return new Failure<>(error);
  }

  boolean isSuccess();

  /**
   * The value.
   *
   * @return the value
   * @throws SecretNoLongerValidException if this is a failure
   */
  U getOrThrow();

  default boolean isFailure() {
    return !isSuccess();
  }

  default U getOrElse(U fallback) {
    return isSuccess() ? getOrThrow() : fallback;
  }

  default Optional<SecretNoLongerValidException> error() {
    return this instanceof Failure<U> failure ? Optional.of(failure.cause()) : Optional.empty();
  }

  default Optional<U> toOptional() {
    return isSuccess() ? Optional.ofNullable(getOrThrow()) : Optional.empty();
  }

  default <V> SecretResult<V> map(Function<U, V> f) {
    return flatMap(u -> success(f.apply(u)));
  }

  @SuppressWarnings("unchecked")
  default <V> SecretResult<V> flatMap(Function<U, SecretResult<V>> f) {
    return isSuccess() ? f.apply(getOrThrow()) : (SecretResult<V>) this;
  }

  default <V> V fold(Function<SecretNoLongerValidException, V> onFailure, Function<U, V> onSuccess) {
    return this instanceof Failure<U> failure ? onFailure.apply(failure.cause()) : onSuccess.apply(getOrThrow());
  }

  /**
   * Successful access.
   *
   * @param value the value
   * @param <U>   the value type
   */
  record Success<U>(U value) implements SecretResult<U> {

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public U getOrThrow() {
      return value;
    }
  }

  /**
   * Access to a destroyed secret.
   *
   * @param cause the error raised by the destroyed secret
   * @param <U>   the value type
   */
  record Failure<U>(SecretNoLongerValidException cause) implements SecretResult<U> {

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public U getOrThrow() {
      throw cause;
    }
  }
}
