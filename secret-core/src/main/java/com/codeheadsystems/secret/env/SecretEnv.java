package com.codeheadsystems.secret.env;

import com.codeheadsystems.secret.OneShotSecret;
import com.codeheadsystems.secret.Secret;
import com.codeheadsystems.secret.strategy.ObfuscationStrategies;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps environment variables into secrets as soon as they are read.
 */
public class SecretEnv {

  private static final Logger log = LoggerFactory.getLogger(SecretEnv.class);

  private final SysEnv sysEnv;

  /**
   * Instantiates a new Secret env reading the process environment.
   */
  public SecretEnv() {
    this(SysEnv.system());
  }

  /**
   * Instantiates a new Secret env.
   *
   * @param sysEnv the sys env
   */
  public SecretEnv(final SysEnv sysEnv) {
    this.sysEnv = sysEnv;
  }

  public Optional<Secret<String>> secret(String key) {
    log.trace("secret({})", key);
    return sysEnv.getEnv(key).map(value -> Secret.of(value, ObfuscationStrategies.STRING));
  }

  public Optional<OneShotSecret<String>> oneShotSecret(String key) {
    log.trace("oneShotSecret({})", key);
    return sysEnv.getEnv(key).map(value -> OneShotSecret.of(value, ObfuscationStrategies.STRING));
  }

  /**
   * The variable as a secret.
   *
   * @param key the key
   * @return the secret
   * @throws IllegalStateException naming the key when the variable is not set
   */
  public Secret<String> requireSecret(String key) {
    return secret(key).orElseThrow(() ->
        new IllegalStateException("Missing required environment variable: " + key));
  }
}
