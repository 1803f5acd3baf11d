package com.helios.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.helios.transform.core.JsonTransformer;
import com.helios.transform.core.action.ActionExecutor;
import com.helios.transform.core.compiler.CompilationException;
import com.helios.transform.core.compiler.RuleSetCompiler;
import com.helios.transform.core.evaluation.ConditionEvaluator;
import com.helios.transform.core.path.PathResolver;
import com.helios.transform.infra.cache.PathExpressionCache;
import com.helios.transform.infra.config.TransformConfig;
import com.helios.transform.infra.management.RuleSetManager;
import com.helios.transform.infrastructure.telemetry.TracingService;
import com.helios.transform.model.RuleSet;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point: {@code TransformApplication [<rules.json>] <doc.json>...}.
 * <p>
 * Loads the rule file, transforms each document file and prints the results as
 * pretty JSON, one per document, to standard output.
 */
public class TransformApplication {
    private static final Logger logger = Logger.getLogger(TransformApplication.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final TransformConfig config;
    private final Tracer tracer;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TransformApplication(TransformConfig config, Tracer tracer) {
        this.config = config;
        this.tracer = tracer;
    }

    public static void main(String[] args) {
        configureLogging();
        TracingService tracingService = TracingService.getInstance();
        TransformApplication app = new TransformApplication(TransformConfig.fromEnvironment(), tracingService.getTracer());
        int exitCode = app.run(args, System.out, System.err);
        tracingService.shutdown();
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * With a single argument the rules come from the configured rule file. While the
     * batch runs, the rule file is monitored at the configured interval and each
     * document is transformed against the snapshot active when it is read.
     *
     * @return process exit code
     */
    int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println("Usage: TransformApplication [<rules.json>] <document.json>...");
            return EXIT_USAGE;
        }

        Path rulesPath = args.length == 1 ? config.rulesFile() : Paths.get(args[0]);
        List<String> documents = Arrays.asList(args).subList(args.length == 1 ? 0 : 1, args.length);

        PathExpressionCache pathCache = PathExpressionCache.builder()
                .maxSize(config.pathCacheMaxSize())
                .build();

        RuleSetManager manager;
        try {
            manager = new RuleSetManager(rulesPath, new RuleSetCompiler(tracer, pathCache), tracer, config.reloadInterval());
        } catch (IOException | CompilationException e) {
            logger.log(Level.SEVERE, "Failed to load rules from " + rulesPath + ": " + e.getMessage());
            err.println("Failed to load rules: " + e.getMessage());
            return EXIT_FAILURE;
        }

        JsonTransformer transformer = new JsonTransformer(
                new PathResolver(pathCache), new ConditionEvaluator(), new ActionExecutor(), tracer);
        ObjectWriter writer = objectMapper.writerWithDefaultPrettyPrinter();

        manager.start();
        int exitCode = EXIT_OK;
        try {
            for (String document : documents) {
                try {
                    JsonNode input = objectMapper.readTree(Paths.get(document).toFile());
                    RuleSet ruleSet = manager.getRuleSet();
                    out.println(writer.writeValueAsString(transformer.apply(input, ruleSet)));
                } catch (IOException e) {
                    logger.log(Level.WARNING, "Skipping unreadable document " + document + ": " + e.getMessage());
                    err.println("Failed to read " + document + ": " + e.getMessage());
                    exitCode = EXIT_FAILURE;
                }
            }
        } finally {
            manager.shutdown();
        }
        return exitCode;
    }

    private static void configureLogging() {
        try (InputStream config = TransformApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
    }
}
