package com.codeheadsystems.secret.hash;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class Sha3HasherTest {

  private final Sha3Hasher hasher = new Sha3Hasher();

  @Test
  void hash_isDeterministic() {
    assertThat(hasher.hashValue("my_password")).isEqualTo(hasher.hashValue("my_password"));
  }

  @Test
  void hash_differentInputsDiffer() {
    assertThat(hasher.hashValue("a")).isNotEqualTo(hasher.hashValue("b"));
  }

  @Test
  void hash_is256BitHex() {
    HashedTag tag = hasher.hashValue("my_password");
    assertThat(tag.algorithm()).isEqualTo(Sha3Hasher.ALGORITHM);
    assertThat(tag.digest()).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  void hash_doesNotContainPlaintext() {
    assertThat(hasher.hashValue("my_password").toString()).doesNotContain("my_password");
  }

  @Test
  void hash_charsBytesAndStringAgree() {
    HashedTag fromString = hasher.hashValue("token");
    assertThat(hasher.hash("token".toCharArray())).isEqualTo(fromString);
    assertThat(hasher.hash("token".getBytes(StandardCharsets.UTF_8))).isEqualTo(fromString);
    assertThat(hasher.hashValue("token".toCharArray())).isEqualTo(fromString);
  }

  @Test
  void hash_nonStringValuesUseStringForm() {
    assertThat(hasher.hashValue(42)).isEqualTo(hasher.hashValue("42"));
  }

  @Test
  void hash_domainSeparatorChangesTag() {
    Sha3Hasher other = new Sha3Hasher("other-domain".getBytes(StandardCharsets.UTF_8));
    assertThat(other.hashValue("token")).isNotEqualTo(hasher.hashValue("token"));
  }

  @Test
  void toString_joinsAlgorithmAndDigest() {
    HashedTag tag = new HashedTag("sha3-256", "abcd");
    assertThat(tag).hasToString("sha3-256:abcd");
  }
}
