package com.devos.notification.service;

import com.devos.notification.model.QueuedJob;

/** 永続キューのジョブ種別ごとのハンドラ。例外を送出すると再試行される。 */
@FunctionalInterface
public interface JobHandler {

  void handle(QueuedJob job);
}
