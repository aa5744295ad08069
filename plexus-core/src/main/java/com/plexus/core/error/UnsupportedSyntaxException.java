package com.plexus.core.error;

/**
 * Source text parsed fine but uses a construct the decompiler cannot express as a graph.
 */
public class UnsupportedSyntaxException extends PlexusException {

    private final int line;

    public UnsupportedSyntaxException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    /** 1-based source line, or 0 when unknown. */
    public int line() { return line; }
}
