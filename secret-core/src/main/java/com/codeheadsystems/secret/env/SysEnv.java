package com.codeheadsystems.secret.env;

import java.util.Map;
import java.util.Optional;

/**
 * Source of environment variables. Injectable so tests do not depend on the process environment.
 */
public interface SysEnv {

  /**
   * The process environment.
   *
   * @return the sys env
   */
  static SysEnv system() {
    return key -> Optional.ofNullable(System.getenv(key));
  }

  /**
   * A fixed set of variables.
   *
   * @param values the values
   * @return the sys env
   */
  static SysEnv fromMap(Map<String, String> values) {
    Map<String, String> copy = Map.copyOf(values);
    return key -> Optional.ofNullable(copy.get(key));
  }

  Optional<String> getEnv(String key);
}
