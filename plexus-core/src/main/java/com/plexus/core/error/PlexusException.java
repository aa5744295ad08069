package com.plexus.core.error;

/**
 * Base type for every failure raised by the compiler or decompiler.
 * A translation that throws never returns partial output.
 */
public abstract class PlexusException extends RuntimeException {

    protected PlexusException(String message) { super(message); }
}
