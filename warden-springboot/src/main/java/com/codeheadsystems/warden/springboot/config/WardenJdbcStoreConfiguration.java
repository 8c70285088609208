package com.codeheadsystems.warden.springboot.config;

import com.codeheadsystems.warden.jdbc.JdbcAuditLog;
import com.codeheadsystems.warden.jdbc.JdbcCredentialStore;
import com.codeheadsystems.warden.jdbc.JdbcFailedAttemptStore;
import com.codeheadsystems.warden.jdbc.JdbcTransactor;
import com.codeheadsystems.warden.jdbc.SchemaMigrator;
import com.codeheadsystems.warden.server.store.AuditLog;
import com.codeheadsystems.warden.server.store.CredentialStore;
import com.codeheadsystems.warden.server.store.FailedAttemptStore;
import com.codeheadsystems.warden.server.store.StoreTransactor;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Durable stores, used when the application context has a {@link DataSource}. The schema is
 * migrated before the first store is handed out.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnBean(DataSource.class)
class WardenJdbcStoreConfiguration {

  private static final Logger log = LoggerFactory.getLogger(WardenJdbcStoreConfiguration.class);

  @Bean
  @ConditionalOnMissingBean(StoreTransactor.class)
  public JdbcTransactor storeTransactor(DataSource dataSource, WardenProperties props) {
    int applied = new SchemaMigrator(dataSource).migrate();
    log.info("Using JDBC credential stores ({} migrations applied)", applied);
    return new JdbcTransactor(dataSource, props.getQueryTimeoutSeconds());
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialStore credentialStore(JdbcTransactor transactor) {
    return new JdbcCredentialStore(transactor);
  }

  @Bean
  @ConditionalOnMissingBean
  public AuditLog auditLog(JdbcTransactor transactor) {
    return new JdbcAuditLog(transactor);
  }

  @Bean
  @ConditionalOnMissingBean
  public FailedAttemptStore failedAttemptStore(JdbcTransactor transactor) {
    return new JdbcFailedAttemptStore(transactor);
  }
}
