/*
 * どこで: Notification インフラ設定
 * 何を: Redis 操作で利用する StringRedisTemplate とバッチ取り出し用 Lua を提供する
 * なぜ: TTL 付きの共有状態を複数インスタンスから同じ形で扱うため
 */
package com.devos.notification.config;

import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

@Configuration
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  // LRANGE と DEL を 1 スクリプトで実行し、読み取りとクリアの間に append が割り込まないようにする
  @Bean
  @SuppressWarnings("rawtypes")
  RedisScript<List> batchDrainScript() {
    return RedisScript.of(new ClassPathResource("redis/batch-drain.lua"), List.class);
  }
}
