package com.plexus.core.compiler;

/**
 * Output settings for {@link GraphCompiler}.
 */
public class CompilerOptions {

    /** Spaces per block level in generated source. */
    public final int indent;

    /** Whether the generated program ends with a newline. */
    public final boolean trailingNewline;

    public CompilerOptions(int indent, boolean trailingNewline) {
        if (indent < 1) {
            throw new IllegalArgumentException("indent must be positive: " + indent);
        }
        this.indent = indent;
        this.trailingNewline = trailingNewline;
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(4, false);
    }
}
