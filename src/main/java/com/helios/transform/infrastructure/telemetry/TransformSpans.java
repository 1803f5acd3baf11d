package com.helios.transform.infrastructure.telemetry;

import com.helios.transform.model.RuleSet;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.nio.file.Path;

/**
 * Names and attributes of the spans this service emits, and factories that start
 * them with their identifying attributes already set. Callers own the returned span
 * and must end it.
 */
public final class TransformSpans {

    public static final String TRANSFORM_DOCUMENT = "transform-document";
    public static final String COMPILE_RULES = "compile-rules";
    public static final String LOAD_RULE_SOURCE = "load-rule-source";
    public static final String RELOAD_RULE_FILE = "reload-rule-file";
    public static final String CHECK_RULE_FILE = "check-rule-file";

    public static final AttributeKey<Long> RULE_SET_VERSION = AttributeKey.longKey("helios.rule_set.version");
    public static final AttributeKey<Long> RULE_COUNT = AttributeKey.longKey("helios.rule_set.rule_count");
    public static final AttributeKey<String> RULE_SOURCE = AttributeKey.stringKey("helios.rule_set.source");
    public static final AttributeKey<Long> MUTATION_COUNT = AttributeKey.longKey("helios.document.mutation_count");
    public static final AttributeKey<Long> COMPILATION_TIME_MS = AttributeKey.longKey("helios.compilation.time_ms");

    private TransformSpans() {
    }

    public static Span startTransform(Tracer tracer, RuleSet ruleSet) {
        return tracer.spanBuilder(TRANSFORM_DOCUMENT)
                .setAttribute(RULE_SET_VERSION, ruleSet.getVersion())
                .setAttribute(RULE_COUNT, (long) ruleSet.size())
                .startSpan();
    }

    public static Span startCompile(Tracer tracer, Path rulesPath) {
        return tracer.spanBuilder(COMPILE_RULES)
                .setAttribute(RULE_SOURCE, rulesPath.toString())
                .startSpan();
    }

    public static Span startLoad(Tracer tracer, String source) {
        return tracer.spanBuilder(LOAD_RULE_SOURCE)
                .setAttribute(RULE_SOURCE, source)
                .startSpan();
    }

    public static Span startReload(Tracer tracer, Path rulesPath) {
        return tracer.spanBuilder(RELOAD_RULE_FILE)
                .setAttribute(RULE_SOURCE, rulesPath.toString())
                .startSpan();
    }

    public static Span startFileCheck(Tracer tracer, Path rulesPath) {
        return tracer.spanBuilder(CHECK_RULE_FILE)
                .setAttribute(RULE_SOURCE, rulesPath.toString())
                .startSpan();
    }

    /** Stamps the snapshot a load or reload produced. */
    public static void recordPublished(Span span, RuleSet published) {
        span.setAttribute(RULE_SET_VERSION, published.getVersion());
        span.setAttribute(RULE_COUNT, (long) published.size());
    }

    public static void recordFailure(Span span, Throwable failure) {
        span.recordException(failure);
        span.setStatus(StatusCode.ERROR, String.valueOf(failure.getMessage()));
    }
}
