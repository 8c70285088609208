package com.codeheadsystems.warden.springboot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings bound from the {@code warden.*} namespace.
 * <p>
 * Defaults match the core policies: five failures per fifteen minutes, an eight character
 * password minimum and Argon2id at 64 MiB, three passes.
 */
@Validated
@ConfigurationProperties(prefix = "warden")
public class WardenProperties {

  private String jwtSecretHex = "";
  private long jwtTtlSeconds = 3600;
  private String jwtIssuer = "warden";
  private int argon2MemoryKib = 65536;
  private int argon2Iterations = 3;
  private int argon2Parallelism = 1;
  private int rateLimitMaxAttempts = 5;
  private long rateLimitWindowSeconds = 900;
  private int passwordMinimumLength = 8;
  private long lockTimeoutMillis = 5000;
  private int queryTimeoutSeconds = 5;
  @Valid
  private List<SeedPrincipal> seedPrincipals = new ArrayList<>();

  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  public String getJwtIssuer() {
    return jwtIssuer;
  }

  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  public int getRateLimitMaxAttempts() {
    return rateLimitMaxAttempts;
  }

  public void setRateLimitMaxAttempts(int rateLimitMaxAttempts) {
    this.rateLimitMaxAttempts = rateLimitMaxAttempts;
  }

  public long getRateLimitWindowSeconds() {
    return rateLimitWindowSeconds;
  }

  public void setRateLimitWindowSeconds(long rateLimitWindowSeconds) {
    this.rateLimitWindowSeconds = rateLimitWindowSeconds;
  }

  public int getPasswordMinimumLength() {
    return passwordMinimumLength;
  }

  public void setPasswordMinimumLength(int passwordMinimumLength) {
    this.passwordMinimumLength = passwordMinimumLength;
  }

  public long getLockTimeoutMillis() {
    return lockTimeoutMillis;
  }

  public void setLockTimeoutMillis(long lockTimeoutMillis) {
    this.lockTimeoutMillis = lockTimeoutMillis;
  }

  public int getQueryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  public List<SeedPrincipal> getSeedPrincipals() {
    return seedPrincipals;
  }

  public void setSeedPrincipals(List<SeedPrincipal> seedPrincipals) {
    this.seedPrincipals = seedPrincipals;
  }

  /**
   * A principal enrolled at startup. Development only.
   */
  public static class SeedPrincipal {

    @NotEmpty
    private String id;
    @NotEmpty
    private String pin;
    @NotEmpty
    private String password;

    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = id;
    }

    public String getPin() {
      return pin;
    }

    public void setPin(String pin) {
      this.pin = pin;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }
  }
}
