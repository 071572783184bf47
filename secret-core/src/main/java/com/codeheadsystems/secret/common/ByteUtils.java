package com.codeheadsystems.secret.common;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Utility methods for the byte encodings used by the obfuscation strategies.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Masks {@code data} with {@code key}. Masking the result again with the same key restores the
   * data. Neither input is modified.
   *
   * @param data the data
   * @param key  the key, as long as the data
   * @return the masked bytes
   */
  public static byte[] xor(byte[] data, byte[] key) {
    if (data.length != key.length) {
      throw new IllegalArgumentException("Key of " + key.length + " bytes cannot mask " + data.length + " bytes");
    }
    byte[] masked = data.clone();
    for (int i = 0; i < masked.length; i++) {
      masked[i] ^= key[i];
    }
    return masked;
  }

  /**
   * Overwrites the given arrays with zeros. Null arrays are ignored.
   *
   * @param arrays the arrays to scrub
   */
  public static void wipe(byte[]... arrays) {
    for (byte[] arr : arrays) {
      if (arr != null) {
        Arrays.fill(arr, (byte) 0);
      }
    }
  }

  /**
   * Overwrites the given array with zeros. Null is ignored.
   *
   * @param chars the chars to scrub
   */
  public static void wipe(char[] chars) {
    if (chars != null) {
      Arrays.fill(chars, '\0');
    }
  }

  /**
   * Encodes chars as UTF-8 without creating an intermediate {@link String}.
   *
   * @param chars the chars
   * @return the byte [ ]
   */
  public static byte[] utf8(char[] chars) {
    ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(chars));
    byte[] out = new byte[encoded.remaining()];
    encoded.get(out);
    if (encoded.hasArray()) {
      wipe(encoded.array());
    }
    return out;
  }

  /**
   * Decodes UTF-8 bytes into chars without creating an intermediate {@link String}.
   *
   * @param bytes the bytes
   * @return the char [ ]
   */
  public static char[] utf8Chars(byte[] bytes) {
    CharBuffer decoded = StandardCharsets.UTF_8.decode(ByteBuffer.wrap(bytes));
    char[] out = new char[decoded.remaining()];
    decoded.get(out);
    if (decoded.hasArray()) {
      wipe(decoded.array());
    }
    return out;
  }

  /**
   * Big-endian UTF-16 code units of {@code chars}. Unlike a charset encoder this never replaces
   * unpaired surrogates, so every char array survives {@link #utf16Chars(byte[])} unchanged.
   *
   * @param chars the chars
   * @return two bytes per char
   */
  public static byte[] utf16(char[] chars) {
    byte[] out = new byte[chars.length * Character.BYTES];
    for (int i = 0; i < chars.length; i++) {
      out[2 * i] = (byte) (chars[i] >> 8);
      out[2 * i + 1] = (byte) chars[i];
    }
    return out;
  }

  /**
   * Inverse of {@link #utf16(char[])}.
   *
   * @param bytes an even number of bytes
   * @return the chars
   */
  public static char[] utf16Chars(byte[] bytes) {
    if (bytes.length % Character.BYTES != 0) {
      throw new IllegalArgumentException("UTF-16 input must have an even length but got " + bytes.length);
    }
    char[] out = new char[bytes.length / Character.BYTES];
    for (int i = 0; i < out.length; i++) {
      out[i] = (char) (((bytes[2 * i] & 0xFF) << 8) | (bytes[2 * i + 1] & 0xFF));
    }
    return out;
  }

  /**
   * Big-endian encoding of a long.
   *
   * @param value the value
   * @return the 8 bytes
   */
  public static byte[] fromLong(long value) {
    byte[] result = new byte[Long.BYTES];
    for (int i = Long.BYTES - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Big-endian decoding of a long.
   *
   * @param bytes exactly 8 bytes
   * @return the long
   */
  public static long toLong(byte[] bytes) {
    requireLength(bytes, Long.BYTES);
    long value = 0;
    for (byte b : bytes) {
      value = (value << 8) | (b & 0xFF);
    }
    return value;
  }

  /**
   * Big-endian encoding of an int.
   *
   * @param value the value
   * @return the 4 bytes
   */
  public static byte[] fromInt(int value) {
    byte[] result = new byte[Integer.BYTES];
    for (int i = Integer.BYTES - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Big-endian decoding of an int.
   *
   * @param bytes exactly 4 bytes
   * @return the int
   */
  public static int toInt(byte[] bytes) {
    requireLength(bytes, Integer.BYTES);
    int value = 0;
    for (byte b : bytes) {
      value = (value << 8) | (b & 0xFF);
    }
    return value;
  }

  /**
   * Big-endian encoding of a short.
   *
   * @param value the value
   * @return the 2 bytes
   */
  public static byte[] fromShort(short value) {
    return new byte[]{(byte) (value >> 8), (byte) value};
  }

  /**
   * Big-endian decoding of a short.
   *
   * @param bytes exactly 2 bytes
   * @return the short
   */
  public static short toShort(byte[] bytes) {
    requireLength(bytes, Short.BYTES);
    return (short) (((bytes[0] & 0xFF) << 8) | (bytes[1] & 0xFF));
  }

  private static void requireLength(byte[] bytes, int expected) {
    if (bytes.length != expected) {
      throw new IllegalArgumentException("Expected " + expected + " bytes but got " + bytes.length);
    }
  }
}
