package com.codeheadsystems.warden.springboot.config;

import com.codeheadsystems.warden.server.auth.SessionManager;
import com.codeheadsystems.warden.server.config.RateLimitPolicy;
import com.codeheadsystems.warden.server.config.SecretPolicy;
import com.codeheadsystems.warden.server.hash.Argon2SecretHasher;
import com.codeheadsystems.warden.server.hash.SecretHasher;
import com.codeheadsystems.warden.server.manager.CredentialManager;
import com.codeheadsystems.warden.server.manager.CredentialRotationManager;
import com.codeheadsystems.warden.server.manager.PrincipalLocks;
import com.codeheadsystems.warden.server.manager.RateLimiter;
import com.codeheadsystems.warden.server.model.CredentialKind;
import com.codeheadsystems.warden.server.store.AuditLog;
import com.codeheadsystems.warden.server.store.CredentialStore;
import com.codeheadsystems.warden.server.store.FailedAttemptStore;
import com.codeheadsystems.warden.server.store.InMemorySessionStore;
import com.codeheadsystems.warden.server.store.SessionStore;
import com.codeheadsystems.warden.server.store.StoreTransactor;
import com.codeheadsystems.warden.springboot.health.SecretHasherHealthIndicator;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Core beans of the credential workflow. Every bean backs off when the application defines its
 * own. Stores are JDBC backed when a {@code DataSource} bean exists, in memory otherwise.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@EnableConfigurationProperties(WardenProperties.class)
@Import({WardenJdbcStoreConfiguration.class, WardenInMemoryStoreConfiguration.class})
public class WardenAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(WardenAutoConfiguration.class);

  /**
   * Default {@link SecureRandom} instance. Override this bean to supply a custom implementation.
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionStore sessionStore(Clock clock) {
    log.warn("Using in-memory session store. Sessions will be lost on restart.");
    return new InMemorySessionStore(clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public SecretHasher secretHasher(WardenProperties props, SecureRandom secureRandom) {
    return new Argon2SecretHasher(
        props.getArgon2MemoryKib(),
        props.getArgon2Iterations(),
        props.getArgon2Parallelism(),
        secureRandom);
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialManager credentialManager(WardenProperties props, CredentialStore credentialStore,
                                             SecretHasher secretHasher, Clock clock) {
    CredentialManager manager = new CredentialManager(credentialStore, secretHasher, clock);
    for (WardenProperties.SeedPrincipal seed : props.getSeedPrincipals()) {
      log.warn("Seeding principal '{}' from configuration. Do not use in production.", seed.getId());
      manager.enroll(seed.getId(), CredentialKind.PIN, seed.getPin());
      manager.enroll(seed.getId(), CredentialKind.PASSWORD, seed.getPassword());
    }
    return manager;
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionManager sessionManager(WardenProperties props, SessionStore sessionStore,
                                       SecureRandom secureRandom, Clock clock) {
    String secretHex = props.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured - generating randomly. "
          + "Sessions will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      secureRandom.nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new SessionManager(secret, props.getJwtIssuer(), props.getJwtTtlSeconds(),
        sessionStore, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimiter rateLimiter(WardenProperties props, FailedAttemptStore failedAttemptStore,
                                 Clock clock) {
    return new RateLimiter(failedAttemptStore,
        new RateLimitPolicy(props.getRateLimitMaxAttempts(),
            Duration.ofSeconds(props.getRateLimitWindowSeconds())),
        clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialRotationManager credentialRotationManager(WardenProperties props,
                                                             CredentialManager credentialManager,
                                                             RateLimiter rateLimiter,
                                                             AuditLog auditLog,
                                                             SessionManager sessionManager,
                                                             StoreTransactor storeTransactor,
                                                             Clock clock) {
    return new CredentialRotationManager(
        credentialManager,
        rateLimiter,
        auditLog,
        sessionManager,
        storeTransactor,
        new SecretPolicy(props.getPasswordMinimumLength()),
        new PrincipalLocks(PrincipalLocks.DEFAULT_STRIPES, Duration.ofMillis(props.getLockTimeoutMillis())),
        clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public SecretHasherHealthIndicator secretHasherHealthIndicator(SecretHasher secretHasher) {
    return new SecretHasherHealthIndicator(secretHasher);
  }
}
