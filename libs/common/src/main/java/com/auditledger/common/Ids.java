package com.auditledger.common;

import java.util.UUID;

public final class Ids {
  private Ids() {}

  public static String newEventId() {
    return UUID.randomUUID().toString();
  }

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }
}
