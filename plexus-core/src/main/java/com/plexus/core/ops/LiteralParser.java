package com.plexus.core.ops;

import com.plexus.core.ast.Ast;
import com.plexus.core.ast.SourceParser;
import com.plexus.core.error.PlexusException;

/**
 * Parses the text of a graph literal input. Only constants and collection displays of
 * constants are accepted; names, calls and operators are rejected so that literal text can
 * never smuggle executable code into generated source.
 */
public final class LiteralParser {

    private LiteralParser() {}

    /**
     * @return canonical source text of the literal
     * @throws IllegalArgumentException if {@code text} is not a pure literal
     */
    public static String parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("literal text is empty");
        }
        Ast.Expression expr;
        try {
            expr = new SourceParser(text.strip()).parseStandaloneExpression();
        } catch (PlexusException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        if (!(expr instanceof Ast.Literal)) {
            throw new IllegalArgumentException("not a literal expression: " + text);
        }
        return ((Ast.Literal) expr).text();
    }
}
