package com.dcruver.goalrec.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a grounded model export.
 * Tasks, methods and propositions are referenced by name.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelDocument {
    private List<String> initialState = new ArrayList<>();
    private List<TaskEntry> tasks = new ArrayList<>();
    private List<MethodEntry> methods = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TaskEntry {
        private String name;
        private String kind;
        private List<String> preconditions = new ArrayList<>();
        private List<String> addEffects = new ArrayList<>();
        private List<String> deleteEffects = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MethodEntry {
        private String name;
        private String task;
        private List<String> subtasks = new ArrayList<>();
        private List<List<Integer>> orderings = new ArrayList<>();
    }
}
