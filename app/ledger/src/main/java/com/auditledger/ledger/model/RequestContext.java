package com.auditledger.ledger.model;

public record RequestContext(
    String tenantId,
    ActorType actorType,
    String actorId,
    String actorEmail,
    String actorIp,
    String actorUserAgent,
    String requestId,
    String sessionId) {

  public static RequestContext system(String tenantId) {
    return new RequestContext(tenantId, ActorType.SYSTEM, "system", null, null, null, null, null);
  }

  public static RequestContext user(String tenantId, String userId, String email, String ip) {
    return new RequestContext(tenantId, ActorType.USER, userId, email, ip, null, null, null);
  }
}
