package com.codeheadsystems.warden.jdbc;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the Warden schema migrations under {@code classpath:db/migration} with Flyway.
 */
public class SchemaMigrator {

  private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

  public static final String DEFAULT_LOCATION = "classpath:db/migration";

  private final Flyway flyway;

  public SchemaMigrator(DataSource dataSource) {
    this.flyway = Flyway.configure()
        .dataSource(dataSource)
        .locations(DEFAULT_LOCATION)
        .cleanDisabled(true)
        .load();
  }

  /**
   * Brings the schema up to date.
   *
   * @return the number of migrations applied by this call
   */
  public int migrate() {
    MigrateResult result = flyway.migrate();
    log.info("Applied {} schema migration(s), schema version {}", result.migrationsExecuted,
        result.targetSchemaVersion);
    return result.migrationsExecuted;
  }
}
