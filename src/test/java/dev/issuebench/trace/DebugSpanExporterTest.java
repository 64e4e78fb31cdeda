package dev.issuebench.trace;

import static org.assertj.core.api.Assertions.*;

import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.List;
import org.junit.jupiter.api.Test;

class DebugSpanExporterTest {

    @Test
    void passesSpansToTheDelegate() {
        var delegate = InMemorySpanExporter.create();
        var tracerProvider =
                SdkTracerProvider.builder()
                        .addSpanProcessor(
                                SimpleSpanProcessor.create(new DebugSpanExporter(delegate)))
                        .build();
        try (var sdk = OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build()) {
            sdk.getTracer("test")
                    .spanBuilder("evaluate")
                    .setAttribute("issue.id", "bug-001")
                    .startSpan()
                    .end();

            assertThat(delegate.getFinishedSpanItems())
                    .extracting(SpanData::getName)
                    .containsExactly("evaluate");
        }
    }

    @Test
    void succeedsWithoutADelegate() {
        var exporter = new DebugSpanExporter();

        assertThat(exporter.export(List.of()).isSuccess()).isTrue();
        assertThat(exporter.flush().isSuccess()).isTrue();
        assertThat(exporter.shutdown().isSuccess()).isTrue();
    }
}
