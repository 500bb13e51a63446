package com.devos.notification.service;

import com.devos.notification.model.JobOptions;
import java.util.UUID;

/** ジョブ種別と JSON ペイロードを永続化し、登録済みハンドラで非同期に処理するキュー。 */
public interface DurableJobQueue {

  UUID enqueue(String jobType, Object payload, JobOptions options);

  void register(String jobType, JobHandler handler);
}
