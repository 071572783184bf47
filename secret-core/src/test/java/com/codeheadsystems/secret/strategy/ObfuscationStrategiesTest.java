package com.codeheadsystems.secret.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.secret.buffer.KeyValueBuffer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ObfuscationStrategiesTest {

  static Stream<Arguments> roundTrips() {
    return Stream.of(
        Arguments.of(ObfuscationStrategies.STRING, "my_password"),
        Arguments.of(ObfuscationStrategies.STRING, ""),
        Arguments.of(ObfuscationStrategies.STRING, "ünïcødé ✓"),
        Arguments.of(ObfuscationStrategies.STRING, "emoji \uD83D\uDD11"),
        Arguments.of(ObfuscationStrategies.STRING, "a\uD800b"),
        Arguments.of(ObfuscationStrategies.STRING, "\uDC00"),
        Arguments.of(ObfuscationStrategies.BYTE, (byte) -7),
        Arguments.of(ObfuscationStrategies.SHORT, Short.MIN_VALUE),
        Arguments.of(ObfuscationStrategies.INTEGER, 42),
        Arguments.of(ObfuscationStrategies.INTEGER, Integer.MIN_VALUE),
        Arguments.of(ObfuscationStrategies.LONG, Long.MAX_VALUE),
        Arguments.of(ObfuscationStrategies.FLOAT, 3.14f),
        Arguments.of(ObfuscationStrategies.DOUBLE, -0.0d),
        Arguments.of(ObfuscationStrategies.DOUBLE, Double.NaN),
        Arguments.of(ObfuscationStrategies.BOOLEAN, true),
        Arguments.of(ObfuscationStrategies.BOOLEAN, false),
        Arguments.of(ObfuscationStrategies.CHARACTER, '€'),
        Arguments.of(ObfuscationStrategies.BIG_INTEGER, new BigInteger("-123456789012345678901234567890")),
        Arguments.of(ObfuscationStrategies.BIG_INTEGER, BigInteger.ZERO),
        Arguments.of(ObfuscationStrategies.BIG_DECIMAL, new BigDecimal("-1234.5678")),
        Arguments.of(ObfuscationStrategies.BIG_DECIMAL, new BigDecimal("1E+10")),
        Arguments.of(ObfuscationStrategies.UUID_VALUE, UUID.randomUUID())
    );
  }

  @ParameterizedTest
  @MethodSource("roundTrips")
  void deObfuscate_restoresValue(ObfuscationStrategy<Object> strategy, Object value) {
    KeyValueBuffer buffer = strategy.obfuscate(value);
    assertThat(strategy.deObfuscate(buffer)).isEqualTo(value);
  }

  @Test
  void chars_roundTrip() {
    char[] value = "s3cr3t".toCharArray();
    KeyValueBuffer buffer = ObfuscationStrategies.CHARS.obfuscate(value);
    assertThat(ObfuscationStrategies.CHARS.deObfuscate(buffer)).isEqualTo("s3cr3t".toCharArray());
    assertThat(value).isEqualTo("s3cr3t".toCharArray());
  }

  @Test
  void chars_unpairedSurrogateRoundTrips() {
    char[] value = {'x', '\uDC00'};
    KeyValueBuffer buffer = ObfuscationStrategies.CHARS.obfuscate(value);
    assertThat(ObfuscationStrategies.CHARS.deObfuscate(buffer)).containsExactly('x', '\uDC00');
  }

  @Test
  void bytes_roundTripReturnsCopy() {
    byte[] value = {1, 2, 3};
    KeyValueBuffer buffer = ObfuscationStrategies.BYTES.obfuscate(value);
    byte[] first = ObfuscationStrategies.BYTES.deObfuscate(buffer);
    first[0] = 99;
    assertThat(ObfuscationStrategies.BYTES.deObfuscate(buffer)).isEqualTo(new byte[]{1, 2, 3});
    assertThat(value).isEqualTo(new byte[]{1, 2, 3});
  }

  @Test
  void bytes_empty() {
    KeyValueBuffer buffer = ObfuscationStrategies.BYTES.obfuscate(new byte[0]);
    assertThat(ObfuscationStrategies.BYTES.deObfuscate(buffer)).isEmpty();
  }

  @Test
  void integer_bufferHasIntLength() {
    assertThat(ObfuscationStrategies.INTEGER.obfuscate(1).length()).isEqualTo(Integer.BYTES);
  }
}
