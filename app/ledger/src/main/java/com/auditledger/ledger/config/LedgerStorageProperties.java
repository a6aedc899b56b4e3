package com.auditledger.ledger.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ledger.storage")
public record LedgerStorageProperties(
    @DefaultValue("jdbc") StorageType type, @DefaultValue("./audit_logs") String basePath) {

  public Path basePathAsPath() {
    return Path.of(basePath);
  }

  public enum StorageType {
    JDBC,
    FILESYSTEM
  }
}
