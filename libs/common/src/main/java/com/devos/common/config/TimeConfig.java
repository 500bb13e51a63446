/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を DI 可能にする (利用側で Clock を定義した場合はそちらを優先する)
 * なぜ: quiet hours やバックオフなど時間窓の計算をすべて同一の時刻源で行うため
 */
package com.devos.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }
}
