package com.helios.transform.core.path;

import com.helios.transform.core.compiler.CompilationException;

/**
 * A path expression that does not follow the path grammar.
 */
public class PathSyntaxException extends CompilationException {

    private final String expression;
    private final int position;

    public PathSyntaxException(String expression, int position, String reason) {
        super("Invalid path '" + expression + "' at position " + position + ": " + reason);
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
