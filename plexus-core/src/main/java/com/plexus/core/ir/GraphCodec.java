package com.plexus.core.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.plexus.core.error.MalformedGraphException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Reads and writes the JSON form of a Graph IR.
 * Node order is significant and is written exactly as held; {@code connections} is always written empty.
 */
public class GraphCodec {

    private static final Gson COMPACT = new GsonBuilder().disableHtmlEscaping().create();
    private static final Gson PRETTY = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    public static class CodecException extends RuntimeException {
        public CodecException(String msg, Throwable cause) { super(msg, cause); }
    }

    public String toJson(IrModel.GraphIr graph, boolean prettyPrint) {
        return gson(prettyPrint).toJson(normalize(graph));
    }

    /**
     * @throws MalformedGraphException if the text is empty or not valid JSON
     */
    public IrModel.GraphIr fromJson(String json) {
        IrModel.GraphIr graph;
        try {
            graph = COMPACT.fromJson(json, IrModel.GraphIr.class);
        } catch (JsonParseException e) {
            throw new MalformedGraphException("Graph JSON is invalid: " + e.getMessage());
        }
        if (graph == null) {
            throw new MalformedGraphException("Graph JSON is empty");
        }
        return graph;
    }

    /**
     * Reads a graph file.
     *
     * @throws CodecException if the file is missing or unreadable
     * @throws MalformedGraphException if its content is not a graph
     */
    public IrModel.GraphIr read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            IrModel.GraphIr graph = COMPACT.fromJson(reader, IrModel.GraphIr.class);
            if (graph == null) {
                throw new MalformedGraphException("Graph file is empty or invalid JSON: " + path);
            }
            return graph;
        } catch (NoSuchFileException e) {
            throw new CodecException("Graph file not found: " + path, e);
        } catch (JsonParseException e) {
            throw new MalformedGraphException("Graph file is not valid JSON: " + path + ": " + e.getMessage());
        } catch (IOException e) {
            throw new CodecException("Failed to read graph file: " + path + ": " + e.getMessage(), e);
        }
    }

    /** Writes {@code graph} to {@code path}, creating parent directories if absent. */
    public void write(IrModel.GraphIr graph, Path path, boolean prettyPrint) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new CodecException("Could not create output directory for: " + path, e);
        }
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson(prettyPrint).toJson(normalize(graph), w);
        } catch (IOException e) {
            throw new CodecException("Failed to write graph file: " + path + ": " + e.getMessage(), e);
        }
    }

    private static Gson gson(boolean prettyPrint) {
        return prettyPrint ? PRETTY : COMPACT;
    }

    private static IrModel.GraphIr normalize(IrModel.GraphIr graph) {
        IrModel.GraphIr out = new IrModel.GraphIr();
        out.nodes = graph.nodes != null ? graph.nodes : new ArrayList<>();
        out.connections = new ArrayList<>();
        return out;
    }
}
