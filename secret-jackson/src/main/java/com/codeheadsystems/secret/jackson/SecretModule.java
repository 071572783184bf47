package com.codeheadsystems.secret.jackson;

import com.codeheadsystems.secret.SecretConfig;
import com.codeheadsystems.secret.strategy.ObfuscationStrategyRegistry;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Jackson support for {@link com.codeheadsystems.secret.Secret} and
 * {@link com.codeheadsystems.secret.OneShotSecret}.
 * <p>
 * Secrets are written as a placeholder or hashed tag and read by wrapping the parsed value. Any
 * Jackson-bound configuration (Dropwizard, Spring Boot) can declare {@code Secret<String>} fields
 * once this module is registered on its {@code ObjectMapper}.
 */
public class SecretModule extends SimpleModule {

  private final TagMode tagMode;
  private final ObfuscationStrategyRegistry registry;
  private final SecretConfig secretConfig;

  /**
   * Placeholder output, default strategies and config.
   */
  public SecretModule() {
    this(TagMode.PLACEHOLDER);
  }

  /**
   * Instantiates a new Secret module with default strategies and config.
   *
   * @param tagMode the tag mode
   */
  public SecretModule(final TagMode tagMode) {
    this(tagMode, ObfuscationStrategyRegistry.DEFAULT, SecretConfig.DEFAULT);
  }

  /**
   * Instantiates a new Secret module.
   *
   * @param tagMode      the tag mode
   * @param registry     resolves strategies for deserialized values
   * @param secretConfig applied to deserialized secrets
   */
  public SecretModule(final TagMode tagMode,
                      final ObfuscationStrategyRegistry registry,
                      final SecretConfig secretConfig) {
    super("SecretModule");
    this.tagMode = tagMode;
    this.registry = registry;
    this.secretConfig = secretConfig;
    addSerializer(new SecretSerializer(tagMode));
  }

  @Override
  public void setupModule(SetupContext context) {
    super.setupModule(context);
    context.addDeserializers(new SecretDeserializers(registry, secretConfig));
  }

  public TagMode tagMode() {
    return tagMode;
  }
}
