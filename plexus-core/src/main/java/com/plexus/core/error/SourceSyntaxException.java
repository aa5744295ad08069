package com.plexus.core.error;

/**
 * Input text is not valid source. Position detail from the tokenizer or parser is
 * folded into the message only.
 */
public class SourceSyntaxException extends PlexusException {

    public SourceSyntaxException(String detail) {
        super("Invalid Python code provided: " + detail);
    }
}
