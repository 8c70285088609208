package com.codeheadsystems.warden.server.hash;

/**
 * One-way, salted hashing of secrets. Encoded hashes carry their own parameters so that
 * hashes written under older settings still verify.
 * <p>
 * Implementations must be thread-safe.
 */
public interface SecretHasher {

  /**
   * Hashes a secret with a fresh random salt.
   *
   * @param secret the raw secret
   * @return the encoded hash
   */
  String hash(String secret);

  /**
   * Verifies a candidate secret against an encoded hash in constant time.
   *
   * @param candidate the raw candidate secret
   * @param encoded   an encoded hash produced by {@link #hash(String)}
   * @return true if the candidate matches, false otherwise or if the hash is malformed
   */
  boolean verify(String candidate, String encoded);

  /**
   * Runs a hash and verify round-trip. Used by health checks.
   *
   * @return true if the hasher is working
   */
  default boolean selfTest() {
    String encoded = hash("self-test");
    return verify("self-test", encoded) && !verify("self-test!", encoded);
  }
}
