package com.plexus.core;

import com.plexus.core.compiler.CompilerOptions;
import com.plexus.core.compiler.GraphCompiler;
import com.plexus.core.decompiler.DecompilerOptions;
import com.plexus.core.decompiler.SourceDecompiler;
import com.plexus.core.ir.GraphCodec;
import com.plexus.core.ir.IrModel.GraphIr;

/**
 * Entry points for embedding callers. Every call is self-contained and shares no mutable
 * state with any other, so independent calls may run on different threads.
 */
public final class Plexus {

    private static final GraphCodec CODEC = new GraphCodec();

    private Plexus() {}

    public static String compile(GraphIr graph) {
        return compile(graph, CompilerOptions.defaults());
    }

    public static String compile(GraphIr graph, CompilerOptions options) {
        return new GraphCompiler(options).compile(graph);
    }

    public static GraphIr decompile(String source) {
        return decompile(source, DecompilerOptions.defaults());
    }

    public static GraphIr decompile(String source, DecompilerOptions options) {
        return new SourceDecompiler(options).decompile(source);
    }

    /** Compiles the JSON form of a graph. */
    public static String compileJson(String graphJson) {
        return compile(CODEC.fromJson(graphJson));
    }

    /** Decompiles source straight to pretty-printed graph JSON. */
    public static String decompileToJson(String source) {
        return CODEC.toJson(decompile(source), true);
    }
}
