package com.devos.notification.service;

/** ジョブハンドラが再試行を要求するときに送出する。永続キューがバックオフ後に再実行する。 */
public class RetryableNotificationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RetryableNotificationException(String message) {
    super(message);
  }

  public RetryableNotificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
