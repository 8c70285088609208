package com.codeheadsystems.warden.server.hash;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Argon2id {@link SecretHasher} on BouncyCastle's {@link Argon2BytesGenerator}.
 * <p>
 * Hashes are encoded in PHC string format:
 * <pre>{@code $argon2id$v=19$m=65536,t=3,p=1$<salt>$<digest>}</pre>
 * with unpadded standard base64 for the salt and digest.
 */
public class Argon2SecretHasher implements SecretHasher {

  private static final Logger log = LoggerFactory.getLogger(Argon2SecretHasher.class);

  public static final int DEFAULT_MEMORY_KIB = 65536;
  public static final int DEFAULT_ITERATIONS = 3;
  public static final int DEFAULT_PARALLELISM = 1;

  private static final String ALGORITHM = "argon2id";
  private static final int SALT_LENGTH = 16;
  private static final int DIGEST_LENGTH = 32;
  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final int memoryKib;
  private final int iterations;
  private final int parallelism;
  private final SecureRandom random;

  /**
   * Creates a hasher with production parameters.
   */
  public Argon2SecretHasher() {
    this(DEFAULT_MEMORY_KIB, DEFAULT_ITERATIONS, DEFAULT_PARALLELISM, new SecureRandom());
  }

  /**
   * Creates a hasher with the given Argon2id cost parameters.
   *
   * @param memoryKib   memory cost in KiB
   * @param iterations  time cost
   * @param parallelism lanes
   * @param random      salt source
   */
  public Argon2SecretHasher(int memoryKib, int iterations, int parallelism, SecureRandom random) {
    if (memoryKib < 8 * parallelism || iterations < 1 || parallelism < 1) {
      throw new IllegalArgumentException("Invalid Argon2 parameters: m=" + memoryKib
          + ", t=" + iterations + ", p=" + parallelism);
    }
    this.memoryKib = memoryKib;
    this.iterations = iterations;
    this.parallelism = parallelism;
    this.random = random;
  }

  /**
   * Cheap parameters for tests. Do not use in production.
   *
   * @return a fast hasher
   */
  public static Argon2SecretHasher forTesting() {
    return new Argon2SecretHasher(256, 1, 1, new SecureRandom());
  }

  @Override
  public String hash(String secret) {
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    byte[] digest = derive(secret, salt, memoryKib, iterations, parallelism, DIGEST_LENGTH);
    try {
      return "$" + ALGORITHM + "$v=" + Argon2Parameters.ARGON2_VERSION_13
          + "$m=" + memoryKib + ",t=" + iterations + ",p=" + parallelism
          + "$" + B64.encodeToString(salt) + "$" + B64.encodeToString(digest);
    } finally {
      Arrays.fill(digest, (byte) 0);
    }
  }

  @Override
  public boolean verify(String candidate, String encoded) {
    ParsedHash parsed;
    try {
      parsed = ParsedHash.parse(encoded);
    } catch (IllegalArgumentException e) {
      log.warn("Stored hash is malformed: {}", e.getMessage());
      return false;
    }
    byte[] actual = derive(candidate, parsed.salt(), parsed.memoryKib(), parsed.iterations(),
        parsed.parallelism(), parsed.digest().length);
    try {
      return org.bouncycastle.util.Arrays.constantTimeAreEqual(actual, parsed.digest());
    } finally {
      Arrays.fill(actual, (byte) 0);
    }
  }

  private static byte[] derive(String secret, byte[] salt, int memoryKib, int iterations,
                               int parallelism, int length) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(memoryKib)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build();
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    gen.init(params);
    byte[] password = secret.getBytes(StandardCharsets.UTF_8);
    byte[] output = new byte[length];
    try {
      gen.generateBytes(password, output, 0, output.length);
    } finally {
      Arrays.fill(password, (byte) 0);
    }
    return output;
  }

  private record ParsedHash(int memoryKib, int iterations, int parallelism, byte[] salt,
                            byte[] digest) {

    // "", "argon2id", "v=19", "m=..,t=..,p=..", salt, digest
    static ParsedHash parse(String encoded) {
      if (encoded == null) {
        throw new IllegalArgumentException("hash is null");
      }
      String[] parts = encoded.split("\\$");
      if (parts.length != 6 || !parts[0].isEmpty() || !ALGORITHM.equals(parts[1])) {
        throw new IllegalArgumentException("not an argon2id PHC string");
      }
      if (!("v=" + Argon2Parameters.ARGON2_VERSION_13).equals(parts[2])) {
        throw new IllegalArgumentException("unsupported version " + parts[2]);
      }
      int m = -1;
      int t = -1;
      int p = -1;
      for (String param : parts[3].split(",")) {
        String[] kv = param.split("=", 2);
        if (kv.length != 2) {
          throw new IllegalArgumentException("bad parameter " + param);
        }
        int value;
        try {
          value = Integer.parseInt(kv[1]);
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("bad parameter " + param, e);
        }
        switch (kv[0]) {
          case "m" -> m = value;
          case "t" -> t = value;
          case "p" -> p = value;
          default -> throw new IllegalArgumentException("unknown parameter " + kv[0]);
        }
      }
      if (m < 1 || t < 1 || p < 1) {
        throw new IllegalArgumentException("missing cost parameters");
      }
      byte[] salt = B64D.decode(parts[4]);
      byte[] digest = B64D.decode(parts[5]);
      if (salt.length == 0 || digest.length == 0) {
        throw new IllegalArgumentException("empty salt or digest");
      }
      return new ParsedHash(m, t, p, salt, digest);
    }
  }
}
