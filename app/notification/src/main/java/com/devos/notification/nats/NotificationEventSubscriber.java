/*
 * どこで: Notification NATS 購読
 * 何を: notification.events の JSON メッセージを購読しイベントハンドラへ渡す
 * なぜ: 各サービスが発行する通知イベントを dispatch に繋ぐため
 */
package com.devos.notification.nats;

import com.devos.notification.config.NotificationNatsProperties;
import com.devos.notification.model.InboundNotificationMessage;
import com.devos.notification.service.NotificationEventHandler;
import com.devos.notification.service.NotificationEventPermanentException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationEventSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(NotificationEventSubscriber.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "NATS Connection は外部管理の共有リソースで、防御的コピーが不可能なため")
    private final Connection connection;

    private final NotificationEventHandler eventHandler;
    private final NotificationNatsProperties properties;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
    private final ObjectMapper objectMapper;

    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    public NotificationEventSubscriber(Connection connection,
            NotificationEventHandler eventHandler,
            NotificationNatsProperties properties,
            ObjectMapper objectMapper) {
        this.connection = connection;
        this.eventHandler = eventHandler;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ensureStream();
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    properties.subject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions());
            logger.info("notification event subscriber started subject={} stream={} durable={}",
                    properties.subject(),
                    properties.stream(),
                    properties.durable());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        try {
            InboundNotificationMessage inbound =
                    objectMapper.readValue(message.getData(), InboundNotificationMessage.class);
            eventHandler.handle(inbound);
            message.ack();
        } catch (IOException ex) {
            // JSON が壊れている場合は再配信しても回復しない
            logger.warn("failed to parse notification event payload", ex);
            termSilently(message);
        } catch (NotificationEventPermanentException ex) {
            logger.warn("permanent failure while handling notification event", ex);
            termSilently(message);
        } catch (DataAccessException ex) {
            logger.warn("temporary failure while handling notification event", ex);
            nakSilently(message);
        } catch (RuntimeException ex) {
            // 不明な例外は再配信に倒す
            logger.warn("failed to handle notification event", ex);
            nakSilently(message);
        }
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.subject())
                .duplicateWindow(properties.duplicateWindow())
                .build();
        JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (!isStreamNotFound(ex)) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
        logger.info("notification stream ensured stream={} subject={}",
                properties.stream(),
                properties.subject());
    }

    private boolean isStreamNotFound(JetStreamApiException ex) {
        return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
                || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.stream())
                .durable(properties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack nats message", ex);
        }
    }

    private void termSilently(Message message) {
        try {
            message.term();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term nats message", ex);
        }
    }
}
