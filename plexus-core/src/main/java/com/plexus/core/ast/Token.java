package com.plexus.core.ast;

public record Token(Type type, String text, int line) {

    public enum Type { NAME, NUMBER, STRING, OP, NEWLINE, INDENT, DEDENT, EOF }

    public boolean is(Type t, String s) {
        return type == t && text.equals(s);
    }

    public boolean isOp(String s) {
        return is(Type.OP, s);
    }

    public boolean isName(String s) {
        return is(Type.NAME, s);
    }

    /** Human-readable form for error messages. */
    public String describe() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case EOF -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
