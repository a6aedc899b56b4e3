package com.auditledger.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
  INFO("info"),
  WARNING("warning"),
  CRITICAL("critical");

  private final String tag;

  Severity(String tag) {
    this.tag = tag;
  }

  @JsonValue
  public String tag() {
    return tag;
  }

  @JsonCreator
  public static Severity fromTag(String tag) {
    for (Severity value : values()) {
      if (value.tag.equals(tag)) {
        return value;
      }
    }
    throw new IllegalArgumentException("unknown severity: " + tag);
  }
}
