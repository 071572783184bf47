package com.codeheadsystems.secret.hash;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class Argon2HasherTest {

  // small cost keeps the test fast
  private final Argon2Hasher hasher =
      new Argon2Hasher("test-salt-16byte".getBytes(StandardCharsets.UTF_8), 64, 1, 1, 32);

  @Test
  void hash_isDeterministic() {
    assertThat(hasher.hashValue("my_password")).isEqualTo(hasher.hashValue("my_password"));
  }

  @Test
  void hash_differentInputsDiffer() {
    assertThat(hasher.hashValue("a")).isNotEqualTo(hasher.hashValue("b"));
  }

  @Test
  void hash_outputSizeAndAlgorithm() {
    HashedTag tag = hasher.hashValue("my_password");
    assertThat(tag.algorithm()).isEqualTo(Argon2Hasher.ALGORITHM);
    assertThat(tag.digest()).hasSize(64);
  }

  @Test
  void hash_saltChangesTag() {
    Argon2Hasher other = new Argon2Hasher("other-salt-16byt".getBytes(StandardCharsets.UTF_8), 64, 1, 1, 32);
    assertThat(other.hashValue("token")).isNotEqualTo(hasher.hashValue("token"));
  }

  @Test
  void salt_isCopiedInAndOut() {
    byte[] salt = "test-salt-16byte".getBytes(StandardCharsets.UTF_8);
    Argon2Hasher copy = new Argon2Hasher(salt, 64, 1, 1, 32);
    HashedTag before = copy.hashValue("token");

    salt[0] ^= 1;
    copy.salt()[1] ^= 1;

    assertThat(copy.hashValue("token")).isEqualTo(before);
    assertThat(copy.salt()).isEqualTo("test-salt-16byte".getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void equals_comparesSaltContents() {
    Argon2Hasher same = new Argon2Hasher("test-salt-16byte".getBytes(StandardCharsets.UTF_8), 64, 1, 1, 32);
    assertThat(same).isEqualTo(hasher).hasSameHashCodeAs(hasher);
    assertThat(new Argon2Hasher("other-salt-16byt".getBytes(StandardCharsets.UTF_8), 64, 1, 1, 32))
        .isNotEqualTo(hasher);
  }

  @Test
  void defaults_areModerate() {
    Argon2Hasher defaults = new Argon2Hasher();
    assertThat(defaults.memory()).isEqualTo(19456);
    assertThat(defaults.iterations()).isEqualTo(2);
    assertThat(defaults.parallelism()).isEqualTo(1);
    assertThat(defaults.outputSize()).isEqualTo(32);
  }
}
