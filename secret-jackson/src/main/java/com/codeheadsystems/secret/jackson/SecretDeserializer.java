package com.codeheadsystems.secret.jackson;

import com.codeheadsystems.secret.OneShotSecret;
import com.codeheadsystems.secret.Secret;
import com.codeheadsystems.secret.SecretApi;
import com.codeheadsystems.secret.SecretConfig;
import com.codeheadsystems.secret.strategy.ObfuscationStrategy;
import com.codeheadsystems.secret.strategy.ObfuscationStrategyRegistry;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidDefinitionException;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the secret's value type with Jackson and wraps it immediately.
 * <p>
 * The parsed value briefly exists in plain form on the heap before it is obfuscated. That is
 * unavoidable when the value arrives through a parser.
 */
public class SecretDeserializer extends StdDeserializer<SecretApi<?>> {

  private static final Logger log = LoggerFactory.getLogger(SecretDeserializer.class);

  private final boolean oneShot;
  private final JavaType valueType;
  private final ObfuscationStrategyRegistry registry;
  private final SecretConfig secretConfig;

  /**
   * Instantiates a new Secret deserializer.
   *
   * @param oneShot      produce {@link OneShotSecret} instead of {@link Secret}
   * @param valueType    the value type
   * @param registry     resolves the strategy of the value type
   * @param secretConfig applied to every secret created
   */
  public SecretDeserializer(final boolean oneShot,
                            final JavaType valueType,
                            final ObfuscationStrategyRegistry registry,
                            final SecretConfig secretConfig) {
    super(oneShot ? OneShotSecret.class : Secret.class);
    this.oneShot = oneShot;
    this.valueType = valueType;
    this.registry = registry;
    this.secretConfig = secretConfig;
  }

  @Override
  public SecretApi<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    log.trace("deserialize(valueType={}, oneShot={})", valueType, oneShot);
    Optional<? extends ObfuscationStrategy<?>> strategy = registry.find(valueType.getRawClass());
    if (strategy.isEmpty()) {
      throw InvalidDefinitionException.from(p,
          "No obfuscation strategy registered for secret value type " + valueType, valueType);
    }
    Object value = ctxt.readValue(p, valueType);
    if (value == null) {
      return null;
    }
    return wrap(value, strategy.get());
  }

  @SuppressWarnings("unchecked")
  private SecretApi<?> wrap(Object value, ObfuscationStrategy<?> strategy) {
    ObfuscationStrategy<Object> typed = (ObfuscationStrategy<Object>) strategy;
    return oneShot
        ? OneShotSecret.of(value, typed, secretConfig)
        : Secret.of(value, typed, secretConfig);
  }
}
