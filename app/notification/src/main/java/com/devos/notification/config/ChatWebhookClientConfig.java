/*
 * どこで: Notification 設定
 * 何を: チャット webhook 呼び出し専用 RestClient を提供する
 * なぜ: 遅いプロバイダが dispatch を止めないよう接続/読み取りタイムアウトを固定するため
 */
package com.devos.notification.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ChatWebhookClientConfig {

  @Bean
  RestClient chatWebhookRestClient(RestClient.Builder builder, NotificationChatProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return builder.requestFactory(requestFactory).build();
  }
}
