package com.devos.notification.repository;

import java.time.Duration;
import java.util.Optional;

public interface PreferencesCacheRepository {

  Optional<String> find(String userId, String workspaceId);

  void put(String userId, String workspaceId, String preferencesJson, Duration ttl);

  void evict(String userId, String workspaceId);
}
