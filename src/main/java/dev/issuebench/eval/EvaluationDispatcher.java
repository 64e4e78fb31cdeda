package dev.issuebench.eval;

import dev.issuebench.config.BenchConfig;
import dev.issuebench.corpus.EvalMethod;
import dev.issuebench.trace.BenchTracing;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.util.Objects;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the evaluation strategy for an issue and runs it.
 *
 * <p>Selection is total: an issue whose evaluation method tag is missing or unknown is judged by
 * {@link JudgedAssessmentStrategy}, so every attempt ends with a verdict.
 */
@Slf4j
public final class EvaluationDispatcher {
    /** Strategy used for tags that name no known method. */
    public static final EvalMethod FALLBACK_METHOD = EvalMethod.LLM_JUDGE;

    private final AutomatedCheckStrategy automatedCheck;
    private final JudgedAssessmentStrategy judgedAssessment;
    private final CustomScriptStrategy customScript;
    private final HybridStrategy hybrid;
    private final Tracer tracer;

    private EvaluationDispatcher(Builder builder) {
        var config = builder.config == null ? BenchConfig.fromEnvironment() : builder.config;
        var runner = builder.runner == null ? CommandRunner.local() : builder.runner;
        var diffProvider =
                builder.diffProvider == null ? DiffProvider.git(runner) : builder.diffProvider;
        this.tracer = builder.tracer == null ? BenchTracing.getTracer() : builder.tracer;
        this.automatedCheck =
                new AutomatedCheckStrategy(runner, config.checkTimeout(), config.detailsLimit());
        this.judgedAssessment =
                new JudgedAssessmentStrategy(
                        runner,
                        diffProvider,
                        config.judgeBinary(),
                        config.judgeTimeout(),
                        config.diffLimit(),
                        config.outputLimit());
        this.customScript =
                new CustomScriptStrategy(runner, config.shell(), config.scriptTimeout());
        this.hybrid = new HybridStrategy(automatedCheck, judgedAssessment);
    }

    public EvaluationStrategy strategyFor(EvalMethod method) {
        return switch (method) {
            case TEST_SUITE -> automatedCheck;
            case LLM_JUDGE -> judgedAssessment;
            case CUSTOM_CHECK -> customScript;
            case HYBRID -> hybrid;
        };
    }

    public EvaluationStrategy strategyFor(@Nullable String methodTag) {
        var method = EvalMethod.fromTag(methodTag);
        if (method.isEmpty()) {
            log.debug(
                    "Unknown evaluation method '{}', falling back to {}",
                    methodTag,
                    FALLBACK_METHOD.tag());
        }
        return strategyFor(method.orElse(FALLBACK_METHOD));
    }

    /** Evaluates one attempt with the strategy its issue asks for. Never throws. */
    public Verdict evaluate(Attempt attempt) {
        var issue = attempt.issue();
        var strategy = strategyFor(issue.evalMethod());
        var span =
                tracer.spanBuilder("evaluate")
                        .setAttribute("issue.id", issue.id())
                        .setAttribute(
                                "eval.method", issue.evalMethod() == null ? "" : issue.evalMethod())
                        .setAttribute("eval.strategy", strategy.name())
                        .startSpan();
        try (var unused = span.makeCurrent()) {
            Verdict verdict;
            try {
                verdict = strategy.evaluate(attempt);
            } catch (RuntimeException e) {
                log.warn("Strategy {} threw for issue {}", strategy.name(), issue.id(), e);
                span.recordException(e);
                span.setStatus(StatusCode.ERROR);
                verdict = Verdict.failed(0.0, "Evaluation failed: " + e);
            }
            span.setAttribute("eval.score", verdict.score());
            span.setAttribute("eval.success", verdict.success());
            log.debug(
                    "Issue {} scored {} via {} (success={})",
                    issue.id(),
                    verdict.score(),
                    strategy.name(),
                    verdict.success());
            return verdict;
        } finally {
            span.end();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for dispatchers. Unset collaborators default to the local machine. */
    public static final class Builder {
        private @Nullable BenchConfig config;
        private @Nullable CommandRunner runner;
        private @Nullable DiffProvider diffProvider;
        private @Nullable Tracer tracer;

        public Builder config(BenchConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        public Builder commandRunner(CommandRunner runner) {
            this.runner = Objects.requireNonNull(runner);
            return this;
        }

        public Builder diffProvider(DiffProvider diffProvider) {
            this.diffProvider = Objects.requireNonNull(diffProvider);
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer);
            return this;
        }

        public EvaluationDispatcher build() {
            return new EvaluationDispatcher(this);
        }
    }
}
