package com.devos.notification.model;

import java.util.Objects;

public record Recipient(String userId, String workspaceId) {

  public Recipient {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(workspaceId, "workspaceId");
  }
}
