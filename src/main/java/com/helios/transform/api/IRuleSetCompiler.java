package com.helios.transform.api;

import com.helios.transform.core.compiler.CompilationException;
import com.helios.transform.model.RuleSet;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for compiling a declarative rule source into an immutable rule set.
 * Compilation is all-or-nothing: either every rule is valid and a complete
 * rule set is returned, or an exception is thrown.
 */
public interface IRuleSetCompiler {

    /**
     * Compiles rules from a JSON file.
     *
     * @param rulesPath path to JSON rules file
     * @return compiled rule set
     * @throws IOException          if the file cannot be read
     * @throws CompilationException if the rules are invalid
     */
    RuleSet compile(Path rulesPath) throws IOException, CompilationException;

    /**
     * Compiles rules from JSON text.
     *
     * @param json   rule source
     * @param source description of where the text came from, kept on the rule set
     * @throws CompilationException if the rules are invalid
     */
    RuleSet compile(String json, String source) throws CompilationException;
}
