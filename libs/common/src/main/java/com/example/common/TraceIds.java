package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {
  public static final String MDC_TRACE_ID = "trace_id";
  private static final String MDC_TRACE_ID_LEGACY = "traceId";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** MDC に載っている trace_id を優先し、無ければ新規採番する。 */
  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_TRACE_ID);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacy = MDC.get(MDC_TRACE_ID_LEGACY);
    if (legacy != null && !legacy.isBlank()) {
      return legacy;
    }
    return newTraceId();
  }
}
