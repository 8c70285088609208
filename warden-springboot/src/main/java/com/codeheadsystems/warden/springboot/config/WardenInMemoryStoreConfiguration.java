package com.codeheadsystems.warden.springboot.config;

import com.codeheadsystems.warden.server.store.AuditLog;
import com.codeheadsystems.warden.server.store.BestEffortTransactor;
import com.codeheadsystems.warden.server.store.CredentialStore;
import com.codeheadsystems.warden.server.store.FailedAttemptStore;
import com.codeheadsystems.warden.server.store.InMemoryAuditLog;
import com.codeheadsystems.warden.server.store.InMemoryCredentialStore;
import com.codeheadsystems.warden.server.store.InMemoryFailedAttemptStore;
import com.codeheadsystems.warden.server.store.StoreTransactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback stores for any store bean nobody else supplied.
 */
@Configuration(proxyBeanMethods = false)
class WardenInMemoryStoreConfiguration {

  private static final Logger log = LoggerFactory.getLogger(WardenInMemoryStoreConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public CredentialStore credentialStore() {
    log.warn("Using in-memory credential store. All data will be lost on restart. Do not use in production.");
    return new InMemoryCredentialStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public AuditLog auditLog() {
    log.warn("Using in-memory audit log. All data will be lost on restart. Do not use in production.");
    return new InMemoryAuditLog();
  }

  @Bean
  @ConditionalOnMissingBean
  public FailedAttemptStore failedAttemptStore() {
    return new InMemoryFailedAttemptStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public StoreTransactor storeTransactor() {
    return new BestEffortTransactor();
  }
}
