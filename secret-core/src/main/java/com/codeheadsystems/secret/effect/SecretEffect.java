package com.codeheadsystems.secret.effect;

import com.codeheadsystems.secret.SecretNoLongerValidException;
import java.util.function.Supplier;

/**
 * The effect a caller wants secret access results wrapped in.
 * <p>
 * {@code R} is the full result type (for example {@code CompletableFuture<U>}) and {@code U} the
 * value it carries. Secrets use the operations below to lift plain values, signal that they were
 * destroyed, run a caller's function and schedule their own destruction after a use completes. See
 * {@link SecretEffects} for the provided instances.
 *
 * @param <R> the effect type
 * @param <U> the carried value type
 */
public interface SecretEffect<R, U> {

  /**
   * Wrap a successful value.
   *
   * @param value the value
   * @return the effect
   */
  R pure(U value);

  /**
   * Wrap the failure raised when a destroyed secret is accessed.
   *
   * @param error the error
   * @return the effect
   */
  R raiseError(SecretNoLongerValidException error);

  /**
   * Run the computation, capturing an exception it throws the way this effect represents failure.
   * Synchronous effects let the exception propagate.
   *
   * @param computation the computation
   * @return the effect
   */
  R defer(Supplier<R> computation);

  /**
   * Run the computation and then the finalizer, whether the computation succeeded, failed or threw.
   * For deferred effects the finalizer runs once the deferred work completes.
   *
   * @param computation the computation
   * @param finalizer   the finalizer
   * @return the effect
   */
  R guarantee(Supplier<R> computation, Runnable finalizer);
}
