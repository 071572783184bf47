package com.codeheadsystems.secret;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.secret.hash.Argon2Hasher;
import com.codeheadsystems.secret.hash.Sha3Hasher;
import org.junit.jupiter.api.Test;

class SecretConfigTest {

  @Test
  void default_usesSha3AndCollectsLocations() {
    assertThat(SecretConfig.DEFAULT.hasher()).isInstanceOf(Sha3Hasher.class);
    assertThat(SecretConfig.DEFAULT.collectDestructionLocation()).isTrue();
  }

  @Test
  void withHasher_keepsOtherSettings() {
    Argon2Hasher argon2 = new Argon2Hasher();
    SecretConfig config = SecretConfig.DEFAULT.withCollectDestructionLocation(false).withHasher(argon2);
    assertThat(config.hasher()).isSameAs(argon2);
    assertThat(config.collectDestructionLocation()).isFalse();
  }
}
