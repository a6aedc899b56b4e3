package com.auditledger.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Action {
  CREATE("create"),
  READ("read"),
  UPDATE("update"),
  DELETE("delete"),
  EXPORT("export");

  private final String tag;

  Action(String tag) {
    this.tag = tag;
  }

  @JsonValue
  public String tag() {
    return tag;
  }

  @JsonCreator
  public static Action fromTag(String tag) {
    for (Action value : values()) {
      if (value.tag.equals(tag)) {
        return value;
      }
    }
    throw new IllegalArgumentException("unknown action: " + tag);
  }
}
