package com.devos.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 既存の trace_id があれば引き継ぎ、無ければ新規採番して MDC に載せる。 */
  public static String ensureInMdc() {
    final String current = MDC.get(MDC_KEY);
    if (current != null && !current.isBlank()) {
      return current;
    }
    final String traceId = newTraceId();
    MDC.put(MDC_KEY, traceId);
    return traceId;
  }
}
