package com.devos.notification.model;

/** チャット連携の健全性。ERROR と INVALID_WEBHOOK は再接続まで送信しない。 */
public enum IntegrationStatus {
  ACTIVE,
  ERROR,
  INVALID_WEBHOOK
}
