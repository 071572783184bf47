package com.codeheadsystems.secret.jackson;

import com.codeheadsystems.secret.OneShotSecret;
import com.codeheadsystems.secret.Secret;
import com.codeheadsystems.secret.SecretConfig;
import com.codeheadsystems.secret.strategy.ObfuscationStrategyRegistry;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.Deserializers;

/**
 * Supplies a {@link SecretDeserializer} bound to the declared value type of each
 * {@code Secret<T>} or {@code OneShotSecret<T>} property.
 */
public class SecretDeserializers extends Deserializers.Base {

  private final ObfuscationStrategyRegistry registry;
  private final SecretConfig secretConfig;

  /**
   * Instantiates a new Secret deserializers.
   *
   * @param registry     the registry
   * @param secretConfig the secret config
   */
  public SecretDeserializers(final ObfuscationStrategyRegistry registry, final SecretConfig secretConfig) {
    this.registry = registry;
    this.secretConfig = secretConfig;
  }

  @Override
  public JsonDeserializer<?> findBeanDeserializer(JavaType type,
                                                  DeserializationConfig config,
                                                  BeanDescription beanDesc) {
    Class<?> raw = type.getRawClass();
    if (raw != Secret.class && raw != OneShotSecret.class) {
      return null;
    }
    return new SecretDeserializer(raw == OneShotSecret.class, type.containedTypeOrUnknown(0), registry, secretConfig);
  }
}
