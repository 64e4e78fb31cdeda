package dev.issuebench.trace;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Collection;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/** Logs every exported span, then hands the batch to an optional delegate. */
@Slf4j
public class DebugSpanExporter implements SpanExporter {
    private final @Nullable SpanExporter delegate;

    public DebugSpanExporter() {
        this(null);
    }

    public DebugSpanExporter(@Nullable SpanExporter delegate) {
        this.delegate = delegate;
    }

    @Override
    public CompletableResultCode export(Collection<SpanData> spans) {
        for (SpanData span : spans) {
            log.info(
                    "Span: name={}, traceId={}, spanId={}, durationMs={}",
                    span.getName(),
                    span.getTraceId(),
                    span.getSpanId(),
                    (span.getEndEpochNanos() - span.getStartEpochNanos()) / 1_000_000);
            log.info("  Attributes: {}", span.getAttributes());
        }
        return delegate == null ? CompletableResultCode.ofSuccess() : delegate.export(spans);
    }

    @Override
    public CompletableResultCode flush() {
        return delegate == null ? CompletableResultCode.ofSuccess() : delegate.flush();
    }

    @Override
    public CompletableResultCode shutdown() {
        return delegate == null ? CompletableResultCode.ofSuccess() : delegate.shutdown();
    }
}
