package com.plexus.core.decompiler;

/**
 * Settings for {@link SourceDecompiler}.
 */
public class DecompilerOptions {

    public final BranchScoping branchScoping;

    public DecompilerOptions(BranchScoping branchScoping) {
        this.branchScoping = branchScoping;
    }

    public static DecompilerOptions defaults() {
        return new DecompilerOptions(BranchScoping.SHARED);
    }
}
