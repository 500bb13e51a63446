/*
 * どこで: Notification アプリのインフラ設定
 * 何を: NATS Connection を Spring 管理下に置き、接続状態の変化をログに残す
 * なぜ: 通知イベント Subscriber が同一接続を再利用し、切断と再接続を追跡できるようにするため
 */
package com.devos.notification.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

    private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties properties) throws IOException, InterruptedException {
        Options options = new Options.Builder()
                .server(properties.url())
                .connectionName("devos-notification")
                .connectionTimeout(properties.connectionTimeout())
                .reconnectWait(properties.reconnectWait())
                .maxReconnects(properties.maxReconnects())
                .connectionListener(connectionListener())
                .build();
        return Nats.connect(options);
    }

    private ConnectionListener connectionListener() {
        return (connection, event) -> {
            switch (event) {
                case DISCONNECTED, CLOSED -> logger.warn("nats connection {} url={}", event, connection.getConnectedUrl());
                default -> logger.info("nats connection {} url={}", event, connection.getConnectedUrl());
            }
        };
    }
}
