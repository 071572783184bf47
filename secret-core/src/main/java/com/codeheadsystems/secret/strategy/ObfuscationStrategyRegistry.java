package com.codeheadsystems.secret.strategy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lookup of obfuscation strategies keyed by value type.
 * <p>
 * Used by collaborators that only know the value's class at runtime (deserializers, config
 * binders). Code that knows its type statically should pass the strategy directly.
 */
public final class ObfuscationStrategyRegistry {

  private static final Logger log = LoggerFactory.getLogger(ObfuscationStrategyRegistry.class);

  /**
   * Registry holding every strategy of {@link ObfuscationStrategies}.
   */
  public static final ObfuscationStrategyRegistry DEFAULT = builder().withDefaults().build();

  private final Map<Class<?>, ObfuscationStrategy<?>> strategies;

  private ObfuscationStrategyRegistry(Map<Class<?>, ObfuscationStrategy<?>> strategies) {
    this.strategies = Map.copyOf(strategies);
  }

  /**
   * Builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Find the strategy registered for the type. Primitive classes resolve to their wrapper.
   *
   * @param type the type
   * @param <T>  the value type
   * @return the strategy, if any
   */
  @SuppressWarnings("unchecked")
  public <T> Optional<ObfuscationStrategy<T>> find(Class<T> type) {
    return Optional.ofNullable((ObfuscationStrategy<T>) strategies.get(wrap(type)));
  }

  /**
   * Get the strategy registered for the type.
   *
   * @param type the type
   * @param <T>  the value type
   * @return the strategy
   * @throws IllegalArgumentException if no strategy is registered for the type
   */
  public <T> ObfuscationStrategy<T> get(Class<T> type) {
    return find(type).orElseThrow(() ->
        new IllegalArgumentException("No obfuscation strategy registered for " + type.getName()));
  }

  /**
   * Strategy for the runtime class of the value.
   *
   * @param value the value
   * @param <T>   the value type
   * @return the strategy
   */
  @SuppressWarnings("unchecked")
  public <T> ObfuscationStrategy<T> forValue(T value) {
    return get((Class<T>) value.getClass());
  }

  public boolean supports(Class<?> type) {
    return strategies.containsKey(wrap(type));
  }

  /**
   * A builder seeded with this registry's strategies.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.strategies.putAll(strategies);
    return builder;
  }

  private static Class<?> wrap(Class<?> type) {
    if (!type.isPrimitive()) {
      return type;
    }
    if (type == int.class) {
      return Integer.class;
    } else if (type == long.class) {
      return Long.class;
    } else if (type == short.class) {
      return Short.class;
    } else if (type == byte.class) {
      return Byte.class;
    } else if (type == boolean.class) {
      return Boolean.class;
    } else if (type == char.class) {
      return Character.class;
    } else if (type == float.class) {
      return Float.class;
    } else if (type == double.class) {
      return Double.class;
    }
    return type;
  }

  /**
   * The type Builder.
   */
  public static class Builder {

    private final Map<Class<?>, ObfuscationStrategy<?>> strategies = new HashMap<>();

    private Builder() {
    }

    /**
     * Registers the built-in strategies.
     *
     * @return the builder
     */
    public Builder withDefaults() {
      return register(String.class, ObfuscationStrategies.STRING)
          .register(char[].class, ObfuscationStrategies.CHARS)
          .register(byte[].class, ObfuscationStrategies.BYTES)
          .register(Byte.class, ObfuscationStrategies.BYTE)
          .register(Short.class, ObfuscationStrategies.SHORT)
          .register(Integer.class, ObfuscationStrategies.INTEGER)
          .register(Long.class, ObfuscationStrategies.LONG)
          .register(Float.class, ObfuscationStrategies.FLOAT)
          .register(Double.class, ObfuscationStrategies.DOUBLE)
          .register(Boolean.class, ObfuscationStrategies.BOOLEAN)
          .register(Character.class, ObfuscationStrategies.CHARACTER)
          .register(BigInteger.class, ObfuscationStrategies.BIG_INTEGER)
          .register(BigDecimal.class, ObfuscationStrategies.BIG_DECIMAL)
          .register(UUID.class, ObfuscationStrategies.UUID_VALUE);
    }

    /**
     * Register a strategy, replacing any previous one for the same type.
     *
     * @param type     the type
     * @param strategy the strategy
     * @param <T>      the value type
     * @return the builder
     */
    public <T> Builder register(Class<T> type, ObfuscationStrategy<T> strategy) {
      log.trace("register({})", type.getName());
      strategies.put(wrap(type), strategy);
      return this;
    }

    public ObfuscationStrategyRegistry build() {
      return new ObfuscationStrategyRegistry(strategies);
    }
  }
}
