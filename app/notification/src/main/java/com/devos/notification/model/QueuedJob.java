package com.devos.notification.model;

import java.util.UUID;

/** ハンドラへ渡すジョブ。attempt は今回の実行回数 (1 始まり)。 */
public record QueuedJob(UUID jobId, String jobType, String payloadJson, int attempt) {}
