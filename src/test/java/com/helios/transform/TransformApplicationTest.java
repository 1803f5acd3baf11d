package com.helios.transform;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.transform.infra.config.TransformConfig;
import com.helios.transform.infrastructure.telemetry.TracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class TransformApplicationTest {

    @TempDir
    Path tempDir;

    private TransformApplication app;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        app = new TransformApplication(TransformConfig.from(key -> null, new Properties()),
                TracingService.getInstance().getTracer());
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return app.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("Transforms each document and prints it as JSON")
    void transformsDocuments() throws Exception {
        Path rules = write("rules.json", """
                [{"id": "r1", "when": "$..code", "condition": {"op": "==", "value": "A"},
                  "action": {"op": "replace", "value": "B"}}]
                """);
        Path first = write("first.json", "{\"code\":\"A\",\"nested\":{\"code\":\"A\"}}");
        Path second = write("second.json", "[{\"code\":\"C\"}]");

        int exitCode = run(rules.toString(), first.toString(), second.toString());

        assertThat(exitCode).isEqualTo(TransformApplication.EXIT_OK);
        String output = out.toString(StandardCharsets.UTF_8);
        ObjectMapper mapper = new ObjectMapper();
        // Two pretty-printed documents, one after the other
        JsonParser parser = mapper.getFactory().createParser(output);
        List<JsonNode> documents = mapper.readValues(parser, JsonNode.class).readAll();
        assertThat(documents).hasSize(2);
        assertThat(documents.get(0).toString()).isEqualTo("{\"code\":\"B\",\"nested\":{\"code\":\"B\"}}");
        assertThat(documents.get(1).toString()).isEqualTo("[{\"code\":\"C\"}]");
    }

    @Test
    @DisplayName("Missing arguments print usage")
    void usage() {
        assertThat(run()).isEqualTo(TransformApplication.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Usage");
    }

    @Test
    @DisplayName("A single argument is a document transformed with the configured rule file")
    void configuredRulesFile() throws Exception {
        Path rules = write("configured.json", """
                [{"id": "up", "when": "$.name", "action": {"op": "uppercase"}}]
                """);
        Path doc = write("doc.json", "{\"name\":\"ann\"}");
        Properties properties = new Properties();
        properties.setProperty("rules.file", rules.toString());
        properties.setProperty("rules.reload.interval.seconds", "0");
        app = new TransformApplication(TransformConfig.from(key -> null, properties),
                TracingService.getInstance().getTracer());

        assertThat(run(doc.toString())).isEqualTo(TransformApplication.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("\"name\" : \"ANN\"");
    }

    @Test
    @DisplayName("Invalid rules fail before any document is processed")
    void invalidRules() throws Exception {
        Path rules = write("rules.json", "[{\"id\": \"x\", \"when\": \"$\", \"action\": {\"op\": \"nope\"}}]");
        Path doc = write("doc.json", "{}");

        assertThat(run(rules.toString(), doc.toString())).isEqualTo(TransformApplication.EXIT_FAILURE);
        assertThat(out.size()).isZero();
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("unknown action operator");
    }

    @Test
    @DisplayName("An unreadable document is reported and the others are still processed")
    void unreadableDocument() throws Exception {
        Path rules = write("rules.json", "[]");
        Path good = write("good.json", "{\"a\":1}");

        int exitCode = run(rules.toString(), tempDir.resolve("missing.json").toString(), good.toString());

        assertThat(exitCode).isEqualTo(TransformApplication.EXIT_FAILURE);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("\"a\" : 1");
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("missing.json");
    }

    @Test
    @DisplayName("A rules file with a number that overflows to infinity is rejected")
    void overflowingRuleParameter() throws Exception {
        Path rules = write("rules.json", "[{\"id\": \"x\", \"when\": \"$.a\", \"action\": {\"op\": \"add\", \"by\": 1e400}}]");
        Path doc = write("doc.json", "{\"a\":1}");

        assertThat(run(rules.toString(), doc.toString())).isEqualTo(TransformApplication.EXIT_FAILURE);
        assertThat(out.size()).isZero();
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("requires a finite");
    }

    @Test
    @DisplayName("A document with a number that overflows to infinity is still transformed")
    void overflowingDocumentNumber() throws Exception {
        Path rules = write("rules.json", """
                [{"id": "bump", "when": "$.x", "action": {"op": "add", "by": 1}},
                 {"id": "up", "when": "$.y", "action": {"op": "uppercase"}}]
                """);
        Path doc = write("doc.json", "{\"x\":1e400,\"y\":\"keep\"}");

        assertThat(run(rules.toString(), doc.toString())).isEqualTo(TransformApplication.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("\"y\" : \"KEEP\"");
        assertThat(err.size()).isZero();
    }
}
