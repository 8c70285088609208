package com.codeheadsystems.warden.dropwizard;

import com.codeheadsystems.warden.dropwizard.auth.WardenAuthenticator;
import com.codeheadsystems.warden.dropwizard.auth.WardenPrincipal;
import com.codeheadsystems.warden.dropwizard.health.SecretHasherHealthCheck;
import com.codeheadsystems.warden.jdbc.JdbcAuditLog;
import com.codeheadsystems.warden.jdbc.JdbcCredentialStore;
import com.codeheadsystems.warden.jdbc.JdbcFailedAttemptStore;
import com.codeheadsystems.warden.jdbc.JdbcTransactor;
import com.codeheadsystems.warden.jdbc.SchemaMigrator;
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
import com.codeheadsystems.warden.server.resource.CredentialResource;
import com.codeheadsystems.warden.server.store.AuditLog;
import com.codeheadsystems.warden.server.store.BestEffortTransactor;
import com.codeheadsystems.warden.server.store.CredentialStore;
import com.codeheadsystems.warden.server.store.FailedAttemptStore;
import com.codeheadsystems.warden.server.store.InMemoryAuditLog;
import com.codeheadsystems.warden.server.store.InMemoryCredentialStore;
import com.codeheadsystems.warden.server.store.InMemoryFailedAttemptStore;
import com.codeheadsystems.warden.server.store.InMemorySessionStore;
import com.codeheadsystems.warden.server.store.SessionStore;
import com.codeheadsystems.warden.server.store.StoreTransactor;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.ManagedDataSource;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the Warden credential workflow into an existing Dropwizard
 * application.
 * <p>
 * Registers the credential JAX-RS resource, a hasher health check, and the bearer token
 * authentication filter so applications can protect their own resources with
 * {@code @Auth WardenPrincipal}. Requires a {@link WardenConfiguration} block in the
 * application's YAML config.
 * <p>
 * Embed in your application; stores are in memory unless the configuration has a
 * {@code database} block:
 * <pre>{@code
 *   bootstrap.addBundle(new WardenBundle<>());
 * }</pre>
 * <p>
 * Or supply your own stores:
 * <pre>{@code
 *   bootstrap.addBundle(new WardenBundle<>(credentialStore, auditLog, failedAttemptStore,
 *       sessionStore, transactor));
 * }</pre>
 */
public class WardenBundle<C extends WardenConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(WardenBundle.class);

  private final CredentialStore credentialStore;
  private final AuditLog auditLog;
  private final FailedAttemptStore failedAttemptStore;
  private final SessionStore sessionStore;
  private final StoreTransactor transactor;

  private CredentialRotationManager credentialRotationManager;
  private AuditLog activeAuditLog;

  /**
   * Creates a bundle whose stores come from the configuration: JDBC when a {@code database}
   * block is present, in memory otherwise.
   */
  public WardenBundle() {
    this.credentialStore = null;
    this.auditLog = null;
    this.failedAttemptStore = null;
    this.sessionStore = null;
    this.transactor = null;
  }

  /**
   * Creates a bundle backed by the supplied stores. The transactor must be the one the stores
   * share, so that each outcome's writes commit together.
   */
  public WardenBundle(CredentialStore credentialStore,
                      AuditLog auditLog,
                      FailedAttemptStore failedAttemptStore,
                      SessionStore sessionStore,
                      StoreTransactor transactor) {
    this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore");
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    this.failedAttemptStore = Objects.requireNonNull(failedAttemptStore, "failedAttemptStore");
    this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
    this.transactor = Objects.requireNonNull(transactor, "transactor");
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    Clock clock = Clock.systemUTC();
    Stores stores = resolveStores(configuration, environment);
    activeAuditLog = stores.auditLog();
    SecretHasher hasher = new Argon2SecretHasher(
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism(),
        new SecureRandom());
    CredentialManager credentialManager = new CredentialManager(stores.credentialStore(), hasher, clock);
    seedPrincipals(configuration, credentialManager);

    SessionManager sessionManager = buildSessionManager(configuration,
        sessionStore != null ? sessionStore : new InMemorySessionStore(clock), clock);
    RateLimiter rateLimiter = new RateLimiter(stores.failedAttemptStore(),
        new RateLimitPolicy(configuration.getRateLimitMaxAttempts(),
            Duration.ofSeconds(configuration.getRateLimitWindowSeconds())),
        clock);

    credentialRotationManager = new CredentialRotationManager(
        credentialManager,
        rateLimiter,
        stores.auditLog(),
        sessionManager,
        stores.transactor(),
        new SecretPolicy(configuration.getPasswordMinimumLength()),
        new PrincipalLocks(PrincipalLocks.DEFAULT_STRIPES,
            Duration.ofMillis(configuration.getLockTimeoutMillis())),
        clock);
    environment.jersey().register(new CredentialResource(credentialRotationManager));
    environment.healthChecks().register("secret-hasher", new SecretHasherHealthCheck(hasher));

    // Bearer token auth filter for application resources
    WardenAuthenticator authenticator = new WardenAuthenticator(sessionManager);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<WardenPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(WardenPrincipal.class));
  }

  /**
   * The workflow built by {@link #run}, for applications that drive it directly.
   *
   * @return the manager, or null before the bundle has run
   */
  public CredentialRotationManager getCredentialRotationManager() {
    return credentialRotationManager;
  }

  /**
   * The audit log the workflow writes to, for operators reading back events.
   *
   * @return the audit log, or null before the bundle has run
   */
  public AuditLog getAuditLog() {
    return activeAuditLog;
  }

  private Stores resolveStores(C configuration, Environment environment) {
    if (credentialStore != null) {
      return new Stores(credentialStore, auditLog, failedAttemptStore, transactor);
    }
    if (configuration.getDatabase() != null) {
      ManagedDataSource dataSource = configuration.getDatabase()
          .build(environment.metrics(), "warden");
      environment.lifecycle().manage(dataSource);
      new SchemaMigrator(dataSource).migrate();
      JdbcTransactor jdbcTransactor = new JdbcTransactor(dataSource,
          configuration.getQueryTimeoutSeconds());
      log.info("Using JDBC credential stores");
      return new Stores(new JdbcCredentialStore(jdbcTransactor), new JdbcAuditLog(jdbcTransactor),
          new JdbcFailedAttemptStore(jdbcTransactor), jdbcTransactor);
    }
    log.warn("""
        #################################################################
        # WARNING: Using in-memory credential, audit and throttling    #
        # stores. All data will be lost on restart.                     #
        # Do not use in production.                                     #
        #################################################################
        """);
    return new Stores(new InMemoryCredentialStore(), new InMemoryAuditLog(),
        new InMemoryFailedAttemptStore(), new BestEffortTransactor());
  }

  private void seedPrincipals(C configuration, CredentialManager credentialManager) {
    for (WardenConfiguration.SeedPrincipal seed : configuration.getSeedPrincipals()) {
      log.warn("Seeding principal '{}' from configuration. Do not use in production.", seed.getId());
      credentialManager.enroll(seed.getId(), CredentialKind.PIN, seed.getPin());
      credentialManager.enroll(seed.getId(), CredentialKind.PASSWORD, seed.getPassword());
    }
  }

  private SessionManager buildSessionManager(C configuration, SessionStore sessions, Clock clock) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured - generating randomly. "
          + "Sessions will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new SessionManager(secret, configuration.getJwtIssuer(),
        configuration.getJwtTtlSeconds(), sessions, clock);
  }

  private record Stores(CredentialStore credentialStore,
                        AuditLog auditLog,
                        FailedAttemptStore failedAttemptStore,
                        StoreTransactor transactor) {
  }
}
