package com.helios.transform.infra.management;

import com.helios.transform.api.IRuleSetCompiler;
import com.helios.transform.api.IRuleSetManager;
import com.helios.transform.core.compiler.CompilationException;
import com.helios.transform.infrastructure.telemetry.TransformSpans;
import com.helios.transform.model.RuleSet;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the active rule set snapshot.
 * <p>
 * Publishing is a single atomic reference swap of a fully built, immutable
 * {@link RuleSet}. A transformation that already read the previous snapshot keeps
 * using it until it finishes; one that reads after the swap sees the new one.
 * A failed load throws to its caller and leaves the active snapshot untouched.
 * <p>
 * When created with a rule file, the manager can poll the file's modification time
 * and recompile on change; failures there are logged and the old snapshot stays.
 */
public class RuleSetManager implements IRuleSetManager {
    private static final Logger logger = Logger.getLogger(RuleSetManager.class.getName());

    private final Path rulesPath;
    private final IRuleSetCompiler compiler;
    private final Tracer tracer;
    private final Duration reloadInterval;

    /**
     * Holds the currently active rule set.
     * <p>
     * Readers always see a complete snapshot without locking; writers serialize on
     * {@code this} so that versions increase in publication order.
     */
    private final AtomicReference<RuleSet> activeRuleSet = new AtomicReference<>(RuleSet.empty());
    private final AtomicLong versionCounter = new AtomicLong();

    private ScheduledExecutorService monitoringExecutor;
    private volatile long lastModifiedTime = -1;
    private volatile Consumer<RuleSet> publishListener;

    /**
     * Creates a manager backed by a rule file and loads it immediately (fail fast).
     */
    public RuleSetManager(Path rulesPath, IRuleSetCompiler compiler, Tracer tracer, Duration reloadInterval)
            throws IOException, CompilationException {
        this.rulesPath = Objects.requireNonNull(rulesPath, "rulesPath");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.reloadInterval = reloadInterval != null ? reloadInterval : Duration.ZERO;

        reload();
    }

    /**
     * Creates a manager without a backing file; it serves the empty rule set until
     * something is published or loaded.
     */
    public RuleSetManager(IRuleSetCompiler compiler, Tracer tracer) {
        this.rulesPath = null;
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.reloadInterval = Duration.ZERO;
    }

    @Override
    public RuleSet getRuleSet() {
        return activeRuleSet.get();
    }

    /**
     * Sets a callback invoked with every newly published snapshot.
     */
    public void setPublishListener(Consumer<RuleSet> listener) {
        this.publishListener = listener;
    }

    @Override
    public synchronized RuleSet publish(RuleSet ruleSet) {
        Objects.requireNonNull(ruleSet, "ruleSet");
        RuleSet versioned = ruleSet.withVersion(versionCounter.incrementAndGet());
        RuleSet previous = activeRuleSet.getAndSet(versioned);
        logger.info(String.format("Published rule set v%d (%d rules from %s, compiled %s), replacing v%d",
                versioned.getVersion(), versioned.size(), versioned.getSource(), versioned.getCreatedAt(),
                previous.getVersion()));

        Consumer<RuleSet> listener = publishListener;
        if (listener != null) {
            try {
                listener.accept(versioned);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Publish listener failed; snapshot remains published", e);
            }
        }
        return versioned;
    }

    /**
     * Compiles rule source text and publishes it.
     *
     * @throws CompilationException if the source is invalid; the active snapshot is unchanged
     */
    public RuleSet load(String json, String source) throws CompilationException {
        Span span = TransformSpans.startLoad(tracer, source);
        try (Scope scope = span.makeCurrent()) {
            RuleSet published = publish(compiler.compile(json, source));
            TransformSpans.recordPublished(span, published);
            return published;
        } catch (CompilationException e) {
            TransformSpans.recordFailure(span, e);
            logger.log(Level.WARNING, "Rejected rule source " + source + ": " + e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Recompiles the backing rule file and publishes it.
     *
     * @throws IllegalStateException if the manager has no backing file
     * @throws IOException           if the file cannot be read
     * @throws CompilationException  if the rules are invalid; the active snapshot is unchanged
     */
    public synchronized RuleSet reload() throws IOException, CompilationException {
        if (rulesPath == null) {
            throw new IllegalStateException("No rule file configured");
        }
        Span span = TransformSpans.startReload(tracer, rulesPath);
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(rulesPath).toMillis();
            RuleSet compiled = compiler.compile(rulesPath);
            RuleSet published = publish(compiled);
            this.lastModifiedTime = modifiedTime;
            TransformSpans.recordPublished(span, published);
            return published;
        } catch (IOException | RuntimeException e) {
            TransformSpans.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public synchronized void start() {
        if (rulesPath == null || reloadInterval.isZero() || reloadInterval.isNegative()) {
            logger.info("Rule file monitoring disabled");
            return;
        }
        if (monitoringExecutor != null) {
            return;
        }
        monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Rule-File-Monitor");
            t.setDaemon(true);
            return t;
        });
        long periodMillis = reloadInterval.toMillis();
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        logger.info("Watching " + rulesPath + " every " + reloadInterval.toMillis() + " ms");
    }

    @Override
    public synchronized void shutdown() {
        if (monitoringExecutor != null) {
            monitoringExecutor.shutdown();
            monitoringExecutor = null;
        }
    }

    void checkForUpdates() {
        Span span = TransformSpans.startFileCheck(tracer, rulesPath);
        try (Scope scope = span.makeCurrent()) {
            long currentModifiedTime = Files.getLastModifiedTime(rulesPath).toMillis();
            if (currentModifiedTime != lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in rule file. Attempting to reload...");
                reloadQuietly(currentModifiedTime);
            }
        } catch (IOException e) {
            TransformSpans.recordFailure(span, e);
            logger.log(Level.WARNING, "Could not check rule file for modifications.", e);
        } catch (RuntimeException e) {
            TransformSpans.recordFailure(span, e);
            logger.log(Level.SEVERE, "An unexpected error occurred during rule reload check.", e);
        } finally {
            span.end();
        }
    }

    private void reloadQuietly(long observedModifiedTime) {
        try {
            reload();
        } catch (IOException | CompilationException e) {
            // Remember the broken version so it is not recompiled on every tick
            this.lastModifiedTime = observedModifiedTime;
            logger.log(Level.SEVERE, "Failed to compile new rule set. Old rule set remains active.", e);
        }
    }
}
