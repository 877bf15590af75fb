package com.strata.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, validated set of tasks. Construction checks that ids are unique and that every
 * {@code dependsOn} entry names a task of the same structure; layers do not re-check this.
 *
 * @param tasks tasks in declaration order
 */
public record DagStructure(List<Task> tasks) implements Serializable {

    public DagStructure {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        Set<String> ids = new LinkedHashSet<>();
        for (Task task : tasks) {
            if (!ids.add(task.id())) {
                throw new InvalidDagException("Duplicate task id: " + task.id());
            }
        }
        for (Task task : tasks) {
            for (String dep : task.dependsOn()) {
                if (!ids.contains(dep)) {
                    throw new InvalidDagException(
                            "Task " + task.id() + " depends on unknown task " + dep);
                }
            }
        }
    }

    public static DagStructure of(Task... tasks) {
        return new DagStructure(List.of(tasks));
    }

    public Optional<Task> task(String id) {
        return tasks.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    public Set<String> ids() {
        Set<String> ids = new LinkedHashSet<>();
        tasks.forEach(t -> ids.add(t.id()));
        return ids;
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    /**
     * Returns a new structure with {@code added} appended. The merged graph is validated,
     * so new tasks may depend on existing ones but may not reuse their ids.
     */
    public DagStructure augment(List<Task> added) {
        var merged = new ArrayList<>(tasks);
        merged.addAll(added);
        return new DagStructure(merged);
    }

    /** Returns a new structure where the task with the same id is replaced. */
    public DagStructure replace(Task replacement) {
        Map<String, Task> byId = new LinkedHashMap<>();
        tasks.forEach(t -> byId.put(t.id(), t));
        if (!byId.containsKey(replacement.id())) {
            throw new InvalidDagException("Unknown task: " + replacement.id());
        }
        byId.put(replacement.id(), replacement);
        return new DagStructure(new ArrayList<>(byId.values()));
    }
}
