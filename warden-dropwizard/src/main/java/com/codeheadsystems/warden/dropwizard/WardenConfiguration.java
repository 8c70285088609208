package com.codeheadsystems.warden.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for the Warden credential service.
 * <p>
 * For production, supply {@code jwtSecretHex} (generate with {@code openssl rand -hex 32}) so that
 * sessions survive restarts, and a {@code database} block so that credentials, the audit trail and
 * throttling state are durable. Without a {@code database} block every store is in memory
 * (dev/test only).
 */
public class WardenConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for session tokens.
   * Leave empty for random generation (dev only - sessions become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Session time-to-live in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 3600;

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "warden";

  /**
   * Argon2id memory cost in kibibytes.
   */
  @Min(8)
  private int argon2MemoryKib = 65536;

  /**
   * Argon2id iteration count.
   */
  @Min(1)
  private int argon2Iterations = 3;

  /**
   * Argon2id parallelism.
   */
  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * Failures allowed per origin, and per principal, inside the throttling window.
   */
  @Min(1)
  private int rateLimitMaxAttempts = 5;

  /**
   * Length of the sliding throttling window in seconds.
   */
  @Min(1)
  private long rateLimitWindowSeconds = 900;

  /**
   * Minimum length of a new password.
   */
  @Min(1)
  private int passwordMinimumLength = 8;

  /**
   * How long a rotation waits for the per-principal lock before failing with 503.
   */
  @Min(1)
  private long lockTimeoutMillis = 5000;

  /**
   * JDBC statement timeout in seconds. Only used with a {@code database} block.
   */
  @Min(1)
  private int queryTimeoutSeconds = 5;

  /**
   * Optional database for durable stores. Migrated with Flyway on startup.
   */
  @Valid
  private DataSourceFactory database;

  /**
   * Principals enrolled on startup. Dev/test only: secrets in configuration are plain text.
   */
  @Valid
  @NotNull
  private List<SeedPrincipal> seedPrincipals = new ArrayList<>();

  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  @JsonProperty
  public int getRateLimitMaxAttempts() {
    return rateLimitMaxAttempts;
  }

  @JsonProperty
  public void setRateLimitMaxAttempts(int rateLimitMaxAttempts) {
    this.rateLimitMaxAttempts = rateLimitMaxAttempts;
  }

  @JsonProperty
  public long getRateLimitWindowSeconds() {
    return rateLimitWindowSeconds;
  }

  @JsonProperty
  public void setRateLimitWindowSeconds(long rateLimitWindowSeconds) {
    this.rateLimitWindowSeconds = rateLimitWindowSeconds;
  }

  @JsonProperty
  public int getPasswordMinimumLength() {
    return passwordMinimumLength;
  }

  @JsonProperty
  public void setPasswordMinimumLength(int passwordMinimumLength) {
    this.passwordMinimumLength = passwordMinimumLength;
  }

  @JsonProperty
  public long getLockTimeoutMillis() {
    return lockTimeoutMillis;
  }

  @JsonProperty
  public void setLockTimeoutMillis(long lockTimeoutMillis) {
    this.lockTimeoutMillis = lockTimeoutMillis;
  }

  @JsonProperty
  public int getQueryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  @JsonProperty
  public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  /**
   * Gets the database factory.
   *
   * @return the database factory, or null when the stores are in memory
   */
  @JsonProperty
  public DataSourceFactory getDatabase() {
    return database;
  }

  @JsonProperty
  public void setDatabase(DataSourceFactory database) {
    this.database = database;
  }

  @JsonProperty
  public List<SeedPrincipal> getSeedPrincipals() {
    return seedPrincipals;
  }

  @JsonProperty
  public void setSeedPrincipals(List<SeedPrincipal> seedPrincipals) {
    this.seedPrincipals = seedPrincipals;
  }

  /**
   * A principal enrolled on startup with both of its secrets.
   */
  public static class SeedPrincipal {

    @NotEmpty
    private String id;

    @NotEmpty
    private String pin;

    @NotEmpty
    private String password;

    @JsonProperty
    public String getId() {
      return id;
    }

    @JsonProperty
    public void setId(String id) {
      this.id = id;
    }

    @JsonProperty
    public String getPin() {
      return pin;
    }

    @JsonProperty
    public void setPin(String pin) {
      this.pin = pin;
    }

    @JsonProperty
    public String getPassword() {
      return password;
    }

    @JsonProperty
    public void setPassword(String password) {
      this.password = password;
    }

    @Override
    public String toString() {
      return "SeedPrincipal[id=" + id + "]";
    }
  }
}
