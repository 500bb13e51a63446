package com.devos.notification.service;

import com.devos.notification.model.ChannelPreferences;
import com.devos.notification.model.NotificationPreferences;
import com.devos.notification.model.NotificationType;

/** dispatch が参照する (userId, workspaceId) 単位の通知設定。 */
public interface PreferenceStore {

  boolean isTypeEnabled(String userId, String workspaceId, NotificationType type);

  ChannelPreferences getChannelPreferences(String userId, String workspaceId, NotificationType type);

  NotificationPreferences getPreferences(String userId, String workspaceId);
}
