package com.auditledger.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActorType {
  USER("user"),
  SERVICE("service"),
  SYSTEM("system");

  private final String tag;

  ActorType(String tag) {
    this.tag = tag;
  }

  @JsonValue
  public String tag() {
    return tag;
  }

  @JsonCreator
  public static ActorType fromTag(String tag) {
    for (ActorType value : values()) {
      if (value.tag.equals(tag)) {
        return value;
      }
    }
    throw new IllegalArgumentException("unknown actor type: " + tag);
  }
}
