package com.codeheadsystems.secret.effect;

import com.codeheadsystems.secret.SecretNoLongerValidException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * The provided {@link SecretEffect} instances.
 */
public final class SecretEffects {

  @SuppressWarnings("rawtypes")
  private static final SecretEffect RESULT = new ResultEffect<>();
  @SuppressWarnings("rawtypes")
  private static final SecretEffect FUTURE = new CompletableFutureEffect<>();
  @SuppressWarnings("rawtypes")
  private static final SecretEffect OPTIONAL = new OptionalEffect<>();
  @SuppressWarnings("rawtypes")
  private static final SecretEffect UNSAFE = new UnsafeEffect<>();

  private SecretEffects() {
  }

  /**
   * Synchronous {@link SecretResult}. Exceptions thrown by the caller's function propagate.
   *
   * @param <U> the value type
   * @return the effect
   */
  @SuppressWarnings("unchecked")
  public static <U> SecretEffect<SecretResult<U>, U> result() {
    return RESULT;
  }

  /**
   * Deferred {@link CompletableFuture}. Destroyed secrets and exceptions thrown by the caller's
   * function surface as failed futures, never as synchronous throws.
   *
   * @param <U> the value type
   * @return the effect
   */
  @SuppressWarnings("unchecked")
  public static <U> SecretEffect<CompletableFuture<U>, U> completableFuture() {
    return FUTURE;
  }

  /**
   * {@link Optional}: a destroyed secret yields {@link Optional#empty()}.
   *
   * @param <U> the value type
   * @return the effect
   */
  @SuppressWarnings("unchecked")
  public static <U> SecretEffect<Optional<U>, U> optional() {
    return OPTIONAL;
  }

  /**
   * The plain value. A destroyed secret throws {@link SecretNoLongerValidException}.
   *
   * @param <U> the value type
   * @return the effect
   */
  @SuppressWarnings("unchecked")
  public static <U> SecretEffect<U, U> unsafe() {
    return UNSAFE;
  }

  private static <R> R runThenFinalize(Supplier<R> computation, Runnable finalizer) {
    try {
      return computation.get();
    } finally {
      finalizer.run();
    }
  }

  private static class ResultEffect<U> implements SecretEffect<SecretResult<U>, U> {

    @Override
    public SecretResult<U> pure(U value) {
      return SecretResult.success(value);
    }

    @Override
    public SecretResult<U> raiseError(SecretNoLongerValidException error) {
      return SecretResult.failure(error);
    }

    @Override
    public SecretResult<U> defer(Supplier<SecretResult<U>> computation) {
      return computation.get();
    }

    @Override
    public SecretResult<U> guarantee(Supplier<SecretResult<U>> computation, Runnable finalizer) {
      return runThenFinalize(computation, finalizer);
    }
  }

  private static class CompletableFutureEffect<U> implements SecretEffect<CompletableFuture<U>, U> {

    @Override
    public CompletableFuture<U> pure(U value) {
      return CompletableFuture.completedFuture(value);
    }

    @Override
    public CompletableFuture<U> raiseError(SecretNoLongerValidException error) {
      return CompletableFuture.failedFuture(error);
    }

    @Override
    public CompletableFuture<U> defer(Supplier<CompletableFuture<U>> computation) {
      try {
        return computation.get();
      } catch (RuntimeException e) {
        return CompletableFuture.failedFuture(e);
      }
    }

    @Override
    public CompletableFuture<U> guarantee(Supplier<CompletableFuture<U>> computation, Runnable finalizer) {
      final CompletableFuture<U> future;
      try {
        future = computation.get();
      } catch (RuntimeException e) {
        finalizer.run();
        return CompletableFuture.failedFuture(e);
      }
      return future.whenComplete((value, error) -> finalizer.run());
    }
  }

  private static class OptionalEffect<U> implements SecretEffect<Optional<U>, U> {

    @Override
    public Optional<U> pure(U value) {
      return Optional.ofNullable(value);
    }

    @Override
    public Optional<U> raiseError(SecretNoLongerValidException error) {
      return Optional.empty();
    }

    @Override
    public Optional<U> defer(Supplier<Optional<U>> computation) {
      return computation.get();
    }

    @Override
    public Optional<U> guarantee(Supplier<Optional<U>> computation, Runnable finalizer) {
      return runThenFinalize(computation, finalizer);
    }
  }

  private static class UnsafeEffect<U> implements SecretEffect<U, U> {

    @Override
    public U pure(U value) {
      return value;
    }

    @Override
    public U raiseError(SecretNoLongerValidException error) {
      throw error;
    }

    @Override
    public U defer(Supplier<U> computation) {
      return computation.get();
    }

    @Override
    public U guarantee(Supplier<U> computation, Runnable finalizer) {
      return runThenFinalize(computation, finalizer);
    }
  }
}
