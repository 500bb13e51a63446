/*
 * どこで: Notification サービス層
 * 何を: 恒久的に処理できない受信イベントを表す例外
 * なぜ: NATS 側で TERM と NAK を判別するため
 */
package com.devos.notification.service;

public class NotificationEventPermanentException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public NotificationEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
