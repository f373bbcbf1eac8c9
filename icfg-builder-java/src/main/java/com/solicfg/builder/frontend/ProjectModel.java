package com.solicfg.builder.frontend;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs matching the project model schema v0.1 emitted by the contract front end.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class ProjectModel {

    private ProjectModel() {}

    public static class ModelRoot {
        @SerializedName("model_version") public String modelVersion;
        @SerializedName("project")       public String project;
        @SerializedName("contracts")     public List<ModelContract> contracts;
    }

    public static class ModelContract {
        @SerializedName("name")      public String name;
        @SerializedName("kind")      public String kind;       // contract, abstract, interface, library
        @SerializedName("bases")     public List<String> bases;
        @SerializedName("functions") public List<ModelFunction> functions;
    }

    public static class ModelFunction {
        @SerializedName("signature")   public String signature;
        @SerializedName("implemented") public Boolean implemented;  // nullable, defaults to true
        @SerializedName("visibility")  public String visibility;
        @SerializedName("nodes")       public List<ModelNode> nodes;
    }

    public static class ModelNode {
        @SerializedName("id")    public int id;
        @SerializedName("label") public String label;
        @SerializedName("repr")  public String repr;
        @SerializedName("entry") public boolean entry;
        @SerializedName("exit")  public boolean exit;
        @SerializedName("sons")  public List<Integer> sons;
        @SerializedName("calls") public List<ModelCall> calls;
    }

    public static class ModelCall {
        @SerializedName("kind")     public String kind;      // internal, super, high_level, library, low_level
        @SerializedName("contract") public String contract;  // nullable
        @SerializedName("function") public String function;  // nullable for low-level calls
    }
}
