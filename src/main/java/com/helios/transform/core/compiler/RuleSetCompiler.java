package com.helios.transform.core.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.helios.transform.api.IRuleSetCompiler;
import com.helios.transform.core.action.UnitConversions;
import com.helios.transform.core.path.PathExpression;
import com.helios.transform.core.path.PathSyntaxException;
import com.helios.transform.infra.cache.PathExpressionCache;
import com.helios.transform.infrastructure.telemetry.TransformSpans;
import com.helios.transform.model.Action;
import com.helios.transform.model.ActionOperator;
import com.helios.transform.model.ActionStep;
import com.helios.transform.model.CastTarget;
import com.helios.transform.model.Condition;
import com.helios.transform.model.ConditionOperator;
import com.helios.transform.model.Rule;
import com.helios.transform.model.RuleDefinition;
import com.helios.transform.model.RuleSet;
import com.helios.transform.model.StepParameters;
import com.helios.transform.model.ValueType;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses and validates a JSON rule source into an immutable {@link RuleSet}.
 * <p>
 * Accepted layouts are a top-level array of rule records or an object with a
 * {@code rules} array. Each record is:
 * <pre>{@code
 * {"id": "...", "when": "$..path", "condition": {"op": "==", "value": ...},
 *  "action": {"op": "replace", "value": ...}}
 * }</pre>
 * with {@code condition} optional and {@code action} either a single operation or
 * {@code {"op": "sequence", "steps": [...]}}.
 * <p>
 * Validation is all-or-nothing: the first structural problem (missing field, unknown
 * operator, malformed path, parameter of the wrong type) aborts compilation with a
 * {@link CompilationException} naming the rule. Disabled rules are validated like
 * the others but left out of the result.
 */
public class RuleSetCompiler implements IRuleSetCompiler {
    private static final Logger logger = Logger.getLogger(RuleSetCompiler.class.getName());

    private static final Map<String, DateTimeFormatter> NAMED_FORMATS = Map.ofEntries(
            Map.entry("ISO_LOCAL_DATE", DateTimeFormatter.ISO_LOCAL_DATE),
            Map.entry("ISO_LOCAL_TIME", DateTimeFormatter.ISO_LOCAL_TIME),
            Map.entry("ISO_LOCAL_DATE_TIME", DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            Map.entry("ISO_OFFSET_DATE_TIME", DateTimeFormatter.ISO_OFFSET_DATE_TIME),
            Map.entry("ISO_ZONED_DATE_TIME", DateTimeFormatter.ISO_ZONED_DATE_TIME),
            Map.entry("ISO_DATE", DateTimeFormatter.ISO_DATE),
            Map.entry("ISO_DATE_TIME", DateTimeFormatter.ISO_DATE_TIME),
            Map.entry("ISO_INSTANT", DateTimeFormatter.ISO_INSTANT),
            Map.entry("BASIC_ISO_DATE", DateTimeFormatter.BASIC_ISO_DATE),
            Map.entry("RFC_1123_DATE_TIME", DateTimeFormatter.RFC_1123_DATE_TIME)
    );

    private static final Map<String, ChronoUnit> UNIT_NAMES = Map.ofEntries(
            Map.entry("millis", ChronoUnit.MILLIS),
            Map.entry("milliseconds", ChronoUnit.MILLIS),
            Map.entry("second", ChronoUnit.SECONDS),
            Map.entry("seconds", ChronoUnit.SECONDS),
            Map.entry("minute", ChronoUnit.MINUTES),
            Map.entry("minutes", ChronoUnit.MINUTES),
            Map.entry("hour", ChronoUnit.HOURS),
            Map.entry("hours", ChronoUnit.HOURS),
            Map.entry("day", ChronoUnit.DAYS),
            Map.entry("days", ChronoUnit.DAYS),
            Map.entry("week", ChronoUnit.WEEKS),
            Map.entry("weeks", ChronoUnit.WEEKS),
            Map.entry("month", ChronoUnit.MONTHS),
            Map.entry("months", ChronoUnit.MONTHS),
            Map.entry("year", ChronoUnit.YEARS),
            Map.entry("years", ChronoUnit.YEARS)
    );

    static final int MAX_ROUND_DIGITS = 1000;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Tracer tracer;
    private final PathExpressionCache pathCache;

    /**
     * @param pathCache parsed paths shared across compilations, so a reload only
     *                  parses the expressions that changed
     */
    public RuleSetCompiler(Tracer tracer, PathExpressionCache pathCache) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.pathCache = Objects.requireNonNull(pathCache, "pathCache");
    }

    public RuleSetCompiler(Tracer tracer) {
        this(tracer, new PathExpressionCache());
    }

    public RuleSetCompiler() {
        this(OpenTelemetry.noop().getTracer("noop"));
    }

    @Override
    public RuleSet compile(Path rulesPath) throws IOException, CompilationException {
        Span span = TransformSpans.startCompile(tracer, rulesPath);
        try (Scope scope = span.makeCurrent()) {
            String content = Files.readString(rulesPath);
            return compile(content, rulesPath.toString());
        } catch (IOException | CompilationException e) {
            TransformSpans.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public RuleSet compile(String json, String source) throws CompilationException {
        long startTime = System.nanoTime();

        List<RuleDefinition> definitions = loadRules(json);
        List<Rule> rules = validateAndCompile(definitions);

        long compilationTime = System.nanoTime() - startTime;
        Span.current().setAttribute(TransformSpans.RULE_COUNT, (long) rules.size());
        Span.current().setAttribute(TransformSpans.COMPILATION_TIME_MS, TimeUnit.NANOSECONDS.toMillis(compilationTime));
        logger.info(String.format("Compiled %d rules (%d defined) from %s in %d ms",
                rules.size(), definitions.size(), source, TimeUnit.NANOSECONDS.toMillis(compilationTime)));

        return new RuleSet(rules, 0L, source, Instant.now());
    }

    private List<RuleDefinition> loadRules(String json) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CompilationException("Rule source is not valid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode rulesNode = tree;
        if (tree != null && tree.isObject()) {
            rulesNode = tree.get("rules");
        }
        if (rulesNode == null || !rulesNode.isArray()) {
            throw new CompilationException("Rule source must be an array of rules or an object with a 'rules' array");
        }

        List<RuleDefinition> definitions = new ArrayList<>(rulesNode.size());
        for (int i = 0; i < rulesNode.size(); i++) {
            JsonNode element = rulesNode.get(i);
            if (!element.isObject()) {
                throw new CompilationException("Rule at index " + i + " is not an object");
            }
            try {
                definitions.add(objectMapper.treeToValue(element, RuleDefinition.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new CompilationException("Rule at index " + i + " is malformed: " + e.getMessage(), e);
            }
        }
        return definitions;
    }

    private List<Rule> validateAndCompile(List<RuleDefinition> definitions) {
        Set<String> ids = new HashSet<>();
        List<Rule> rules = new ArrayList<>(definitions.size());

        for (int i = 0; i < definitions.size(); i++) {
            RuleDefinition def = definitions.get(i);

            if (def.id() == null || def.id().isBlank()) {
                throw new CompilationException("Rule at index " + i + " has missing or empty id");
            }
            if (!ids.add(def.id())) {
                throw new CompilationException("Duplicate rule id: " + def.id());
            }

            Rule rule = new Rule(
                    def.id(),
                    compilePath(def),
                    def.condition() != null ? compileCondition(def.id(), def.condition()) : null,
                    compileAction(def.id(), def.action())
            );

            if (!def.enabled()) {
                logger.fine("Skipping disabled rule '" + def.id() + "'");
                continue;
            }
            rules.add(rule);
        }
        return rules;
    }

    private PathExpression compilePath(RuleDefinition def) {
        if (def.when() == null || def.when().isBlank()) {
            throw new CompilationException("Rule '" + def.id() + "' has missing or empty 'when' path");
        }
        try {
            return pathCache.get(def.when());
        } catch (PathSyntaxException e) {
            throw new CompilationException("Rule '" + def.id() + "' has invalid path: " + e.getMessage(), e);
        }
    }

    // ---- conditions ----

    private Condition compileCondition(String ruleId, RuleDefinition.ConditionDefinition cond) {
        if (cond.op() == null) {
            throw new CompilationException("Rule '" + ruleId + "' condition has null op");
        }
        ConditionOperator operator = ConditionOperator.fromString(cond.op());
        if (operator == null) {
            throw new CompilationException("Rule '" + ruleId + "' has unknown condition operator: " + cond.op());
        }

        JsonNode value = cond.value();

        if (operator.isUnary()) {
            if (value == null || value.isNull()) {
                return new Condition(operator, BooleanNode.TRUE, null);
            }
            if (!value.isBoolean()) {
                throw new CompilationException("Rule '" + ruleId + "' operator " + cond.op() + " accepts only a boolean value");
            }
            return new Condition(operator, value, null);
        }

        if (value == null) {
            throw new CompilationException("Rule '" + ruleId + "' condition has no value for operator " + cond.op());
        }
        requireFinite(ruleId, value, "condition value");

        switch (operator) {
            case IS_ANY_OF, IS_NONE_OF -> {
                if (!value.isArray() || value.isEmpty()) {
                    throw new CompilationException("Rule '" + ruleId + "' operator " + cond.op() + " requires a non-empty array value");
                }
                for (JsonNode candidate : value) {
                    if (!ValueType.of(candidate).isScalar()) {
                        throw new CompilationException("Rule '" + ruleId + "' operator " + cond.op() + " accepts only scalar candidates");
                    }
                }
            }
            case REGEX -> {
                if (!value.isTextual()) {
                    throw new CompilationException("Rule '" + ruleId + "' regex operator requires a string value");
                }
                try {
                    return new Condition(operator, value, Pattern.compile(value.textValue()));
                } catch (PatternSyntaxException e) {
                    throw new CompilationException("Rule '" + ruleId + "' has invalid regex pattern: " + e.getMessage(), e);
                }
            }
            case STARTS_WITH, ENDS_WITH -> {
                if (!value.isTextual()) {
                    throw new CompilationException("Rule '" + ruleId + "' operator " + cond.op() + " requires a string value");
                }
            }
            case LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL -> {
                if (!ValueType.of(value).isOrderable()) {
                    throw new CompilationException("Rule '" + ruleId + "' ordering operator " + cond.op()
                            + " requires a number or string value, got: " + ValueType.of(value));
                }
            }
            default -> {
                // ==, !=, contains: any JSON value
            }
        }
        return new Condition(operator, value, null);
    }

    // ---- actions ----

    private Action compileAction(String ruleId, ObjectNode action) {
        if (action == null) {
            throw new CompilationException("Rule '" + ruleId + "' has no action");
        }
        ActionOperator operator = requireOperator(ruleId, action);

        if (operator != ActionOperator.SEQUENCE) {
            return Action.single(compileStep(ruleId, operator, action));
        }

        JsonNode steps = action.get("steps");
        if (steps == null || !steps.isArray() || steps.isEmpty()) {
            throw new CompilationException("Rule '" + ruleId + "' sequence requires a non-empty 'steps' array");
        }
        List<ActionStep> compiled = new ArrayList<>(steps.size());
        for (int j = 0; j < steps.size(); j++) {
            JsonNode step = steps.get(j);
            if (!step.isObject()) {
                throw new CompilationException("Rule '" + ruleId + "' sequence step " + j + " is not an object");
            }
            ActionOperator stepOperator = requireOperator(ruleId, (ObjectNode) step);
            if (stepOperator == ActionOperator.SEQUENCE) {
                throw new CompilationException("Rule '" + ruleId + "' sequence step " + j + " cannot itself be a sequence");
            }
            compiled.add(compileStep(ruleId, stepOperator, (ObjectNode) step));
        }
        return Action.sequence(compiled);
    }

    private ActionOperator requireOperator(String ruleId, ObjectNode action) {
        JsonNode op = action.get("op");
        if (op == null || !op.isTextual()) {
            throw new CompilationException("Rule '" + ruleId + "' action has missing or non-string op");
        }
        ActionOperator operator = ActionOperator.fromString(op.textValue());
        if (operator == null) {
            throw new CompilationException("Rule '" + ruleId + "' has unknown action operator: " + op.textValue());
        }
        return operator;
    }

    private ActionStep compileStep(String ruleId, ActionOperator operator, ObjectNode params) {
        StepParameters parameters = switch (operator) {
            case REPLACE, DEFAULT -> {
                JsonNode value = requireParam(ruleId, operator, params, "value");
                requireFinite(ruleId, value, operator.getValue() + " value");
                yield new StepParameters.Value(value);
            }
            case CAST -> {
                JsonNode to = params.has("to") ? params.get("to") : params.get("type");
                CastTarget target = to != null && to.isTextual() ? CastTarget.fromString(to.textValue()) : null;
                if (target == null) {
                    throw new CompilationException("Rule '" + ruleId + "' cast requires 'to' of string, number, integer or boolean");
                }
                yield new StepParameters.CastTo(target);
            }
            case TRIM, UPPERCASE, LOWERCASE -> StepParameters.None.INSTANCE;
            case ADD, SUB, MUL, DIV -> {
                JsonNode by = params.has("by") ? params.get("by") : params.get("value");
                if (by == null || !by.isNumber()) {
                    throw new CompilationException("Rule '" + ruleId + "' " + operator.getValue() + " requires a numeric 'by'");
                }
                if (!ValueType.isNumeric(by)) {
                    throw new CompilationException("Rule '" + ruleId + "' " + operator.getValue() + " requires a finite 'by', got: " + by);
                }
                yield new StepParameters.Operand(by.decimalValue());
            }
            case ROUND -> {
                JsonNode digits = params.get("digits");
                if (digits == null || digits.isNull()) {
                    yield new StepParameters.Digits(0);
                }
                if (!digits.isIntegralNumber() || !digits.canConvertToInt()) {
                    throw new CompilationException("Rule '" + ruleId + "' round requires an integer 'digits'");
                }
                if (digits.intValue() < -MAX_ROUND_DIGITS || digits.intValue() > MAX_ROUND_DIGITS) {
                    throw new CompilationException("Rule '" + ruleId + "' round 'digits' must be between -"
                            + MAX_ROUND_DIGITS + " and " + MAX_ROUND_DIGITS + ", got: " + digits.intValue());
                }
                yield new StepParameters.Digits(digits.intValue());
            }
            case FORMAT_DATE -> {
                String from = requireText(ruleId, operator, params, "from");
                String to = requireText(ruleId, operator, params, "to");
                yield new StepParameters.DateFormat(from, formatter(ruleId, from), to, formatter(ruleId, to));
            }
            case OFFSET_DATE -> {
                JsonNode amount = requireParam(ruleId, operator, params, "amount");
                if (!amount.isIntegralNumber() || !amount.canConvertToLong()) {
                    throw new CompilationException("Rule '" + ruleId + "' offsetDate requires an integer 'amount'");
                }
                String unitName = requireText(ruleId, operator, params, "unit");
                ChronoUnit unit = UNIT_NAMES.get(unitName.toLowerCase(Locale.ROOT));
                if (unit == null) {
                    throw new CompilationException("Rule '" + ruleId + "' offsetDate has unknown unit: " + unitName);
                }
                JsonNode pattern = params.get("pattern");
                DateTimeFormatter format = pattern != null && pattern.isTextual()
                        ? formatter(ruleId, pattern.textValue())
                        : null;
                yield new StepParameters.DateOffset(amount.longValue(), unit, format);
            }
            case CONVERT_UNIT -> {
                String from = requireText(ruleId, operator, params, "from");
                String to = requireText(ruleId, operator, params, "to");
                if (!UnitConversions.isSupported(from, to)) {
                    logger.warning(String.format("Rule '%s' converts %s -> %s, which has no conversion factor; it will never apply",
                            ruleId, from, to));
                }
                yield new StepParameters.UnitPair(from, to);
            }
            case MAP -> compileMapping(ruleId, params);
            case SEQUENCE -> throw new CompilationException("Rule '" + ruleId + "' nested sequence is not allowed");
        };
        return new ActionStep(operator, parameters);
    }

    /**
     * Rejects literals holding numbers too large for an exact decimal value
     * (for example {@code 1e400}, which parses to infinity).
     */
    private static void requireFinite(String ruleId, JsonNode literal, String what) {
        if (literal.isContainerNode()) {
            for (JsonNode child : literal) {
                requireFinite(ruleId, child, what);
            }
        } else if (literal.isNumber() && !ValueType.isNumeric(literal)) {
            throw new CompilationException("Rule '" + ruleId + "' " + what + " is not a finite number: " + literal);
        }
    }

    private StepParameters.ValueMapping compileMapping(String ruleId, ObjectNode params) {
        JsonNode mappings = params.get("mappings");
        JsonNode nullValues = params.get("nullValues");
        if ((mappings == null || !mappings.isObject()) && (nullValues == null || !nullValues.isArray())) {
            throw new CompilationException("Rule '" + ruleId + "' map requires a 'mappings' object or a 'nullValues' array");
        }

        Map<String, JsonNode> table = new LinkedHashMap<>();
        if (mappings != null) {
            if (!mappings.isObject()) {
                throw new CompilationException("Rule '" + ruleId + "' map 'mappings' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = mappings.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                requireFinite(ruleId, entry.getValue(), "map value");
                table.put(entry.getKey().strip(), entry.getValue());
            }
        }

        Set<String> nulls = new HashSet<>();
        if (nullValues != null) {
            if (!nullValues.isArray()) {
                throw new CompilationException("Rule '" + ruleId + "' map 'nullValues' must be an array");
            }
            for (JsonNode value : nullValues) {
                if (!value.isTextual()) {
                    throw new CompilationException("Rule '" + ruleId + "' map 'nullValues' must contain only strings");
                }
                nulls.add(value.textValue().strip());
            }
        }
        return new StepParameters.ValueMapping(table, nulls);
    }

    private static JsonNode requireParam(String ruleId, ActionOperator operator, ObjectNode params, String name) {
        JsonNode value = params.get(name);
        if (value == null) {
            throw new CompilationException("Rule '" + ruleId + "' " + operator.getValue() + " requires '" + name + "'");
        }
        return value;
    }

    private static String requireText(String ruleId, ActionOperator operator, ObjectNode params, String name) {
        JsonNode value = requireParam(ruleId, operator, params, name);
        if (!value.isTextual() || value.textValue().isBlank()) {
            throw new CompilationException("Rule '" + ruleId + "' " + operator.getValue() + " requires a non-empty string '" + name + "'");
        }
        return value.textValue();
    }

    private static DateTimeFormatter formatter(String ruleId, String pattern) {
        DateTimeFormatter named = NAMED_FORMATS.get(pattern);
        if (named != null) {
            return named;
        }
        try {
            return DateTimeFormatter.ofPattern(pattern, Locale.ROOT);
        } catch (IllegalArgumentException e) {
            throw new CompilationException("Rule '" + ruleId + "' has invalid date pattern '" + pattern + "': " + e.getMessage(), e);
        }
    }
}
