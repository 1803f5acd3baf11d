package com.helios.transform.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.transform.api.ITransformer;
import com.helios.transform.core.action.ActionExecutor;
import com.helios.transform.core.evaluation.ConditionEvaluator;
import com.helios.transform.core.path.DocumentRoot;
import com.helios.transform.core.path.PathResolver;
import com.helios.transform.core.path.Slot;
import com.helios.transform.infrastructure.telemetry.TransformSpans;
import com.helios.transform.model.Rule;
import com.helios.transform.model.RuleSet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The rule engine: applies a rule set snapshot to one document in a single pass.
 * <p>
 * For each rule, in authoring order, the path is resolved against the document as
 * earlier rules left it, the optional condition filters the matched slots, and the
 * action is executed on each remaining slot. Rules never short-circuit each other,
 * so when two rules touch the same location the later one is observed last.
 * <p>
 * There is no rollback: nothing that can happen to a single node stops the
 * remaining nodes, steps or rules. The transformer holds no per-document state and
 * may be shared by any number of threads; the snapshot is read, never written.
 */
public class JsonTransformer implements ITransformer {
    private static final Logger logger = Logger.getLogger(JsonTransformer.class.getName());

    private final PathResolver pathResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final ActionExecutor actionExecutor;
    private final Tracer tracer;

    public JsonTransformer(Tracer tracer) {
        this(new PathResolver(), new ConditionEvaluator(), new ActionExecutor(), tracer);
    }

    public JsonTransformer() {
        this(OpenTelemetry.noop().getTracer("noop"));
    }

    public JsonTransformer(PathResolver pathResolver, ConditionEvaluator conditionEvaluator,
                           ActionExecutor actionExecutor, Tracer tracer) {
        this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "conditionEvaluator");
        this.actionExecutor = Objects.requireNonNull(actionExecutor, "actionExecutor");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public JsonNode apply(JsonNode document, RuleSet ruleSet) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(ruleSet, "ruleSet");
        if (ruleSet.isEmpty()) {
            return document;
        }

        Span span = TransformSpans.startTransform(tracer, ruleSet);
        try (Scope scope = span.makeCurrent()) {
            DocumentRoot root = new DocumentRoot(document);
            int mutations = 0;
            for (Rule rule : ruleSet) {
                mutations += applyRule(rule, root);
            }

            span.setAttribute(TransformSpans.MUTATION_COUNT, (long) mutations);
            return root.get();
        } finally {
            span.end();
        }
    }

    /**
     * @return number of slots written by this rule
     */
    private int applyRule(Rule rule, DocumentRoot root) {
        List<Slot> slots = pathResolver.resolve(root, rule.path());
        if (slots.isEmpty()) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Rule '" + rule.id() + "' matched nothing for " + rule.path());
            }
            return 0;
        }

        int written = 0;
        for (Slot slot : slots) {
            if (rule.hasCondition() && !conditionEvaluator.evaluate(rule.condition(), slot.get())) {
                continue;
            }
            if (actionExecutor.execute(rule.action(), slot).isPresent()) {
                written++;
            }
        }
        return written;
    }
}
