package com.plexus.core.error;

/**
 * The Graph IR handed to the compiler is structurally invalid: a missing id, type,
 * field or input, a dangling link, a bad literal, or a link the compiler cannot follow.
 */
public class MalformedGraphException extends PlexusException {

    private final String nodeId;
    private final String field;

    public MalformedGraphException(String message) {
        this(message, null, null);
    }

    public MalformedGraphException(String message, String nodeId, String field) {
        super(message);
        this.nodeId = nodeId;
        this.field = field;
    }

    /** Id of the offending node, or null when the node has none. */
    public String nodeId() { return nodeId; }

    /** Name of the missing or invalid field/input slot, if known. */
    public String field() { return field; }
}
