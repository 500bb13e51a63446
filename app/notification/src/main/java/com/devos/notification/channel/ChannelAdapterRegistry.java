/*
 * どこで: Notification チャネル層
 * 何を: 設定された順序でチャット webhook アダプタを保持する
 * なぜ: dispatch とリトライが同じ順序・同じ可用性判定でアダプタを参照するため
 */
package com.devos.notification.channel;

import com.devos.notification.config.NotificationChatProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ChannelAdapterRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ChannelAdapterRegistry.class);

  private final List<ChannelAdapter> orderedAdapters;

  public ChannelAdapterRegistry(List<ChannelAdapter> adapters, NotificationChatProperties properties) {
    final Map<String, ChannelAdapter> byName = new LinkedHashMap<>();
    for (ChannelAdapter adapter : adapters) {
      byName.put(adapter.channelName(), adapter);
    }
    final List<ChannelAdapter> ordered = new ArrayList<>();
    for (String name : properties.order()) {
      final ChannelAdapter adapter = byName.remove(name);
      if (adapter == null) {
        logger.warn("chat channel listed in order but no adapter exists channel={}", name);
        continue;
      }
      addIfConfigured(ordered, adapter);
    }
    // order に無いアダプタは名前順で末尾に並べる
    byName.keySet().stream().sorted().forEach(name -> addIfConfigured(ordered, byName.get(name)));
    this.orderedAdapters = List.copyOf(ordered);
  }

  public List<ChannelAdapter> orderedAdapters() {
    return orderedAdapters;
  }

  public Optional<ChannelAdapter> find(String channelName) {
    return orderedAdapters.stream()
        .filter(adapter -> adapter.channelName().equals(channelName))
        .findFirst();
  }

  private void addIfConfigured(List<ChannelAdapter> ordered, ChannelAdapter adapter) {
    if (!adapter.isConfigured()) {
      logger.info("chat channel unavailable; not configured channel={}", adapter.channelName());
      return;
    }
    ordered.add(adapter);
  }
}
