package com.devos.notification.service;

/** critical 種別の無効化など、許可されない設定更新を拒否する。 */
public class InvalidNotificationPreferencesException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidNotificationPreferencesException(String message) {
    super(message);
  }
}
