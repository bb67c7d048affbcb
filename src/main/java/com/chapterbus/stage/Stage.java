package com.chapterbus.stage;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Named unit of pipeline work. Call keys must be unique within a stage; they are the
 * merge key of the stage result.
 *
 * A PARALLEL stage that is not {@code concurrent} issues its calls one at a time but
 * keeps the parallel merge rules: no chaining, every call runs, best-effort applies.
 */
public record Stage(String name, CombinationPolicy policy, List<WorkerCall> calls, boolean bestEffort,
                    boolean concurrent) {

    public Stage {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stage name is required");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy is required for stage " + name);
        }
        calls = List.copyOf(calls);
        Set<String> keys = new HashSet<>();
        for (WorkerCall call : calls) {
            if (!keys.add(call.key())) {
                throw new IllegalArgumentException("duplicate call key " + call.key() + " in stage " + name);
            }
        }
    }

    public static Stage sequential(String name, List<WorkerCall> calls) {
        return new Stage(name, CombinationPolicy.SEQUENTIAL, calls, false, false);
    }

    public static Stage parallel(String name, List<WorkerCall> calls, boolean bestEffort) {
        return parallel(name, calls, bestEffort, true);
    }

    public static Stage parallel(String name, List<WorkerCall> calls, boolean bestEffort, boolean concurrent) {
        return new Stage(name, CombinationPolicy.PARALLEL, calls, bestEffort, concurrent);
    }
}
