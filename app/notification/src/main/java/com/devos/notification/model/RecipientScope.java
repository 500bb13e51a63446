package com.devos.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** 受信者解決の対象範囲。kind に応じて userId / projectId を参照する。 */
public record RecipientScope(Kind kind, String workspaceId, String projectId, String userId) {

  public enum Kind {
    USER,
    WORKSPACE,
    PROJECT;

    @JsonCreator
    public static Kind fromValue(String value) {
      return Kind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
  }

  public static RecipientScope user(String userId, String workspaceId) {
    return new RecipientScope(Kind.USER, workspaceId, null, userId);
  }

  public static RecipientScope workspace(String workspaceId) {
    return new RecipientScope(Kind.WORKSPACE, workspaceId, null, null);
  }

  public static RecipientScope project(String projectId, String workspaceId) {
    return new RecipientScope(Kind.PROJECT, workspaceId, projectId, null);
  }
}
