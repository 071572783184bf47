package com.codeheadsystems.secret.strategy;

import com.codeheadsystems.secret.common.ByteUtils;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.UUID;

/**
 * Default XOR strategies for the common value types.
 * <p>
 * {@code String}, {@code BigInteger} and {@code BigDecimal} are immutable, so the values handed
 * back by these strategies cannot be scrubbed. Prefer {@code char[]} or {@code byte[]} for values
 * that must be wiped after use.
 */
public final class ObfuscationStrategies {

  public static final ObfuscationStrategy<String> STRING = new XorObfuscationStrategy<>(
      ObfuscationStrategies::stringToBytes,
      ObfuscationStrategies::bytesToString);

  // UTF-16 code units, so lone surrogates round trip
  public static final ObfuscationStrategy<char[]> CHARS = new XorObfuscationStrategy<>(
      ByteUtils::utf16,
      ByteUtils::utf16Chars);

  public static final ObfuscationStrategy<byte[]> BYTES = new XorObfuscationStrategy<>(
      b -> Arrays.copyOf(b, b.length),
      b -> Arrays.copyOf(b, b.length));

  public static final ObfuscationStrategy<Byte> BYTE = new XorObfuscationStrategy<>(
      v -> new byte[]{v},
      b -> b[0]);

  public static final ObfuscationStrategy<Short> SHORT = new XorObfuscationStrategy<>(
      ByteUtils::fromShort,
      ByteUtils::toShort);

  public static final ObfuscationStrategy<Integer> INTEGER = new XorObfuscationStrategy<>(
      ByteUtils::fromInt,
      ByteUtils::toInt);

  public static final ObfuscationStrategy<Long> LONG = new XorObfuscationStrategy<>(
      ByteUtils::fromLong,
      ByteUtils::toLong);

  public static final ObfuscationStrategy<Float> FLOAT = new XorObfuscationStrategy<>(
      v -> ByteUtils.fromInt(Float.floatToRawIntBits(v)),
      b -> Float.intBitsToFloat(ByteUtils.toInt(b)));

  public static final ObfuscationStrategy<Double> DOUBLE = new XorObfuscationStrategy<>(
      v -> ByteUtils.fromLong(Double.doubleToRawLongBits(v)),
      b -> Double.longBitsToDouble(ByteUtils.toLong(b)));

  public static final ObfuscationStrategy<Boolean> BOOLEAN = new XorObfuscationStrategy<>(
      v -> new byte[]{(byte) (v ? 1 : 0)},
      b -> b[0] != 0);

  public static final ObfuscationStrategy<Character> CHARACTER = new XorObfuscationStrategy<>(
      v -> ByteUtils.fromShort((short) v.charValue()),
      b -> (char) ByteUtils.toShort(b));

  public static final ObfuscationStrategy<BigInteger> BIG_INTEGER = new XorObfuscationStrategy<>(
      BigInteger::toByteArray,
      BigInteger::new);

  // unscaled value bytes followed by the 4-byte scale
  public static final ObfuscationStrategy<BigDecimal> BIG_DECIMAL = new XorObfuscationStrategy<>(
      v -> {
        byte[] unscaled = v.unscaledValue().toByteArray();
        byte[] out = ByteBuffer.allocate(unscaled.length + Integer.BYTES).put(unscaled).putInt(v.scale()).array();
        ByteUtils.wipe(unscaled);
        return out;
      },
      b -> {
        byte[] unscaled = Arrays.copyOf(b, b.length - Integer.BYTES);
        int scale = ByteUtils.toInt(Arrays.copyOfRange(b, b.length - Integer.BYTES, b.length));
        BigDecimal result = new BigDecimal(new BigInteger(unscaled), scale);
        ByteUtils.wipe(unscaled);
        return result;
      });

  public static final ObfuscationStrategy<UUID> UUID_VALUE = new XorObfuscationStrategy<>(
      v -> ByteBuffer.allocate(16).putLong(v.getMostSignificantBits()).putLong(v.getLeastSignificantBits()).array(),
      b -> {
        ByteBuffer buffer = ByteBuffer.wrap(b);
        return new UUID(buffer.getLong(), buffer.getLong());
      });

  private ObfuscationStrategies() {
  }

  private static byte[] stringToBytes(String value) {
    char[] chars = value.toCharArray();
    try {
      return ByteUtils.utf16(chars);
    } finally {
      ByteUtils.wipe(chars);
    }
  }

  private static String bytesToString(byte[] bytes) {
    char[] chars = ByteUtils.utf16Chars(bytes);
    try {
      return new String(chars);
    } finally {
      ByteUtils.wipe(chars);
    }
  }
}
