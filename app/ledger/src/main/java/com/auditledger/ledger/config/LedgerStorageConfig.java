package com.auditledger.ledger.config;

import com.auditledger.ledger.repository.AuditStorage;
import com.auditledger.ledger.repository.CheckpointStore;
import com.auditledger.ledger.repository.FileSystemAuditStorage;
import com.auditledger.ledger.repository.FileSystemCheckpointStore;
import com.auditledger.ledger.repository.JdbcAuditStorage;
import com.auditledger.ledger.repository.JdbcCheckpointStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration(proxyBeanMethods = false)
public class LedgerStorageConfig {

  private static final String TYPE_PROPERTY = "ledger.storage.type";

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "jdbc", matchIfMissing = true)
  static class Jdbc {

    @Bean
    AuditStorage auditStorage(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
      return new JdbcAuditStorage(jdbcTemplate, objectMapper);
    }

    @Bean
    CheckpointStore checkpointStore(
        NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
      return new JdbcCheckpointStore(jdbcTemplate, objectMapper);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "filesystem")
  static class FileSystem {

    @Bean
    AuditStorage auditStorage(LedgerStorageProperties properties, ObjectMapper objectMapper) {
      return new FileSystemAuditStorage(properties.basePathAsPath(), objectMapper);
    }

    @Bean
    CheckpointStore checkpointStore(LedgerStorageProperties properties, ObjectMapper objectMapper) {
      return new FileSystemCheckpointStore(properties.basePathAsPath(), objectMapper);
    }
  }
}
