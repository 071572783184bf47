package com.codeheadsystems.secret.hash;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.util.encoders.Hex;

/**
 * Argon2id with a fixed salt, so the output is deterministic. Slow by construction, which makes
 * brute-forcing tags of weak passwords expensive.
 *
 * @param salt        fixed salt
 * @param memory      memory cost in KB
 * @param iterations  iteration count
 * @param parallelism lanes
 * @param outputSize  digest length in bytes
 */
public record Argon2Hasher(byte[] salt, int memory, int iterations, int parallelism, int outputSize)
    implements Hasher {

  public static final String ALGORITHM = "argon2id";

  public Argon2Hasher {
    salt = Objects.requireNonNull(salt, "salt").clone();
  }

  /**
   * Moderate defaults: 19 MiB, 2 iterations, 1 lane, 32 byte output.
   */
  public Argon2Hasher() {
    this("secret-tag-salt-v1".getBytes(StandardCharsets.UTF_8), 19456, 2, 1, 32);
  }

  @Override
  public HashedTag hash(byte[] input) {
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    Argon2Parameters params =
        new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
            .withSalt(salt)
            .withMemoryAsKB(memory)
            .withIterations(iterations)
            .withParallelism(parallelism)
            .build();
    gen.init(params);
    byte[] output = new byte[outputSize];
    gen.generateBytes(input, output, 0, output.length);
    return new HashedTag(ALGORITHM, Hex.toHexString(output));
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Argon2Hasher that)) {
      return false;
    }
    return memory == that.memory
        && iterations == that.iterations
        && parallelism == that.parallelism
        && outputSize == that.outputSize
        && Arrays.equals(salt, that.salt);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(memory, iterations, parallelism, outputSize) + Arrays.hashCode(salt);
  }

  @Override
  public String toString() {
    return "Argon2Hasher[memory=" + memory + ", iterations=" + iterations + ", parallelism=" + parallelism
        + ", outputSize=" + outputSize + "]";
  }
}
