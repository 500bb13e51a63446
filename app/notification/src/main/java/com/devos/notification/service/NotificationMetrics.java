/*
 * どこで: Notification サービス層
 * 何を: チャネル別の配信結果、バッチ/保留件数、レート制限、重複、再送のメトリクスを記録する
 * なぜ: 配信経路ごとの失敗や滞留を Prometheus から直接観測できるようにするため
 */
package com.devos.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_BATCH_QUEUED_TOTAL = "notification.batch.queued.total";
  private static final String METRIC_BATCH_FLUSHED_TOTAL = "notification.batch.flushed.total";
  private static final String METRIC_QUIET_HOURS_HELD_TOTAL = "notification.quiet_hours.held.total";
  private static final String METRIC_QUIET_HOURS_FLUSHED_TOTAL =
      "notification.quiet_hours.flushed.total";
  private static final String METRIC_RATE_LIMITED_TOTAL = "notification.rate_limited.total";
  private static final String METRIC_DEDUP_HIT_TOTAL = "notification.dedup.hit.total";
  private static final String METRIC_RETRY_TOTAL = "notification.retry.total";
  private static final String METRIC_INTEGRATION_STATUS_TOTAL =
      "notification.integration.status.total";
  private static final String METRIC_JOB_BACKLOG_CURRENT = "notification.job.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger jobBacklogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_JOB_BACKLOG_CURRENT, jobBacklogCurrent, AtomicInteger::get)
        .description("Current number of pending or processing notification jobs")
        .register(meterRegistry);
  }

  public void recordDelivery(String channel, String result) {
    counter(
            METRIC_DELIVERY_TOTAL,
            "Notification delivery outcomes per channel",
            Tags.of("channel", channel, "result", result))
        .increment();
  }

  public void recordBatchQueued() {
    counter(METRIC_BATCH_QUEUED_TOTAL, "Notifications appended to batch buffers", Tags.empty())
        .increment();
  }

  public void recordBatchFlushed(int count) {
    counter(METRIC_BATCH_FLUSHED_TOTAL, "Notifications drained from batch buffers", Tags.empty())
        .increment(Math.max(count, 0));
  }

  public void recordQuietHoursHeld() {
    counter(METRIC_QUIET_HOURS_HELD_TOTAL, "Notifications held during quiet hours", Tags.empty())
        .increment();
  }

  public void recordQuietHoursFlushed(int count) {
    counter(
            METRIC_QUIET_HOURS_FLUSHED_TOTAL,
            "Held notifications flushed into digests",
            Tags.empty())
        .increment(Math.max(count, 0));
  }

  public void recordRateLimited(String channel) {
    counter(
            METRIC_RATE_LIMITED_TOTAL,
            "Sends rejected by the per-target rate limiter",
            Tags.of("channel", channel))
        .increment();
  }

  public void recordDuplicateInteraction() {
    counter(METRIC_DEDUP_HIT_TOTAL, "Inbound interactions dropped as duplicates", Tags.empty())
        .increment();
  }

  public void recordRetry(String result) {
    counter(METRIC_RETRY_TOTAL, "Retry job outcomes", Tags.of("result", result)).increment();
  }

  public void recordIntegrationStatus(String provider, String status) {
    counter(
            METRIC_INTEGRATION_STATUS_TOTAL,
            "Chat integration health transitions",
            Tags.of("provider", provider, "status", status))
        .increment();
  }

  public void updateJobBacklogCurrent(int backlogCount) {
    jobBacklogCurrent.set(Math.max(backlogCount, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
