package com.devos.notification.channel;

import com.devos.notification.model.ChannelSendResult;
import com.devos.notification.model.NotificationEvent;

/** ワークスペース単位で通知を 1 つの外部チャネルへ届けるアダプタ。 */
public interface ChannelAdapter {

  /** 設定やレジストリで使うチャネル名 (例: discord)。 */
  String channelName();

  /** 必要な設定が揃っていなければ false。false のアダプタは存在しないものとして扱う。 */
  boolean isConfigured();

  /** 例外は送出せず、失敗は結果で返す。 */
  ChannelSendResult send(String workspaceId, NotificationEvent notification);
}
