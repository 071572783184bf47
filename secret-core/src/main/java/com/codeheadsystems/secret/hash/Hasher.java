package com.codeheadsystems.secret.hash;

import com.codeheadsystems.secret.common.ByteUtils;
import java.nio.charset.StandardCharsets;

/**
 * Derives a {@link HashedTag} from a plaintext value.
 * <p>
 * Independent of any secret. The same input always produces the same tag for a given hasher
 * configuration, so tags can be compared for log correlation without recovering the value.
 */
public interface Hasher {

  /**
   * Hash the bytes.
   *
   * @param input the input
   * @return the hashed tag
   */
  HashedTag hash(byte[] input);

  /**
   * Hash the UTF-8 encoding of the chars.
   *
   * @param chars the chars
   * @return the hashed tag
   */
  default HashedTag hash(char[] chars) {
    byte[] bytes = ByteUtils.utf8(chars);
    try {
      return hash(bytes);
    } finally {
      ByteUtils.wipe(bytes);
    }
  }

  /**
   * Hash any value. Byte and char arrays are hashed as is, everything else through the UTF-8
   * encoding of {@link String#valueOf(Object)}.
   *
   * @param value the value
   * @return the hashed tag
   */
  default HashedTag hashValue(Object value) {
    if (value instanceof byte[] bytes) {
      return hash(bytes);
    } else if (value instanceof char[] chars) {
      return hash(chars);
    }
    byte[] bytes = String.valueOf(value).getBytes(StandardCharsets.UTF_8);
    try {
      return hash(bytes);
    } finally {
      ByteUtils.wipe(bytes);
    }
  }
}
