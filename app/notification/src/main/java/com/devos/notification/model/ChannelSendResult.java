package com.devos.notification.model;

import java.time.Duration;

/**
 * チャネルアダプタの送信結果。retryable は一時的な失敗で、後で再送すれば成功し得ることを示す。
 */
public record ChannelSendResult(
    boolean sent, String channelName, String error, Duration retryAfter, boolean retryable) {

  public static ChannelSendResult delivered(String channelName) {
    return new ChannelSendResult(true, channelName, null, null, false);
  }

  public static ChannelSendResult failed(String error) {
    return new ChannelSendResult(false, null, error, null, false);
  }

  public static ChannelSendResult transientFailure(String error) {
    return new ChannelSendResult(false, null, error, null, true);
  }

  public static ChannelSendResult retryLater(String error, Duration retryAfter) {
    return new ChannelSendResult(false, null, error, retryAfter, true);
  }
}
