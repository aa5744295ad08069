package com.plexus.cli;

import com.google.gson.annotations.SerializedName;
import com.plexus.core.compiler.CompilerOptions;
import com.plexus.core.decompiler.BranchScoping;
import com.plexus.core.decompiler.DecompilerOptions;

/**
 * Deserialized form of a plexus.json options file. Every key is optional.
 */
public class PlexusConfig {

    /** Spaces per block level in compiled source (default: 4). */
    @SerializedName("indent")
    private Integer indent;

    /** Pretty-print decompiled graph JSON (default: true). */
    @SerializedName("pretty_print")
    private Boolean prettyPrint;

    /** "shared" or "isolated" (default: "shared"). */
    @SerializedName("branch_scoping")
    private String branchScoping;

    @SerializedName("trailing_newline")
    private Boolean trailingNewline;

    public int getIndent()              { return indent != null ? indent : 4; }
    public boolean isPrettyPrint()      { return prettyPrint == null || prettyPrint; }
    public String getBranchScoping()    { return branchScoping != null ? branchScoping : "shared"; }
    public boolean isTrailingNewline()  { return trailingNewline != null && trailingNewline; }

    public static PlexusConfig defaults() {
        return new PlexusConfig();
    }

    public CompilerOptions toCompilerOptions() {
        return new CompilerOptions(getIndent(), isTrailingNewline());
    }

    public DecompilerOptions toDecompilerOptions() {
        return new DecompilerOptions(BranchScoping.fromName(getBranchScoping()));
    }
}
