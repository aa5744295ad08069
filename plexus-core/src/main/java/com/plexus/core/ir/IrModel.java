package com.plexus.core.ir;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * POJOs matching the serialized Graph IR.
 * Field names use @SerializedName for the snake_case wire names; absent fields stay null.
 */
public final class IrModel {

    private IrModel() {}

    public static class GraphIr {
        @SerializedName("nodes")       public List<IrNode> nodes;
        @SerializedName("connections") public List<Object> connections;

        public GraphIr() {}

        public GraphIr(List<IrNode> nodes) {
            this.nodes = nodes;
            this.connections = new ArrayList<>();
        }
    }

    public static class IrNode {
        @SerializedName("id")              public String id;
        @SerializedName("type")            public String type;
        @SerializedName("value")           public String value;           // assign target or operator symbol
        @SerializedName("func_name")       public String funcName;        // call_function
        @SerializedName("target_variable") public String targetVariable;  // for_loop
        @SerializedName("inputs")          public List<IrInput> inputs;
        @SerializedName("body")            public List<IrNode> body;
        @SerializedName("orelse")          public List<IrNode> orelse;

        public List<IrInput> inputsOrEmpty() { return inputs != null ? inputs : Collections.emptyList(); }
        public List<IrNode> bodyOrEmpty()    { return body   != null ? body   : Collections.emptyList(); }
        public List<IrNode> orelseOrEmpty()  { return orelse != null ? orelse : Collections.emptyList(); }
    }

    /** Exactly one of {@code link} and {@code value} is set. */
    public static class IrInput {
        @SerializedName("name")  public String name;
        @SerializedName("link")  public String link;
        @SerializedName("value") public String value;

        public static IrInput link(String name, String nodeId) {
            IrInput in = new IrInput();
            in.name = name;
            in.link = nodeId;
            return in;
        }

        public static IrInput literal(String name, String text) {
            IrInput in = new IrInput();
            in.name = name;
            in.value = text;
            return in;
        }

        public boolean isLink() { return link != null; }
    }
}
