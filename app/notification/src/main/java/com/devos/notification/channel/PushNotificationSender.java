package com.devos.notification.channel;

import com.devos.notification.model.PushMessage;

/** ユーザー単位の push 送信。 */
public interface PushNotificationSender {

  /** push サービスが利用可能か。false の場合 dispatch は push を試みない。 */
  boolean isEnabled();

  void sendToUser(String userId, PushMessage message);
}
