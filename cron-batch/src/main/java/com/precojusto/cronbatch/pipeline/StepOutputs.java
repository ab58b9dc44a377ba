package com.precojusto.cronbatch.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded outputs of checkpointed steps, keyed by step name.
 */
public class StepOutputs {

    private final Map<String, Object> outputs;

    public StepOutputs(Map<String, Object> outputs) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    /**
     * Output of a step.
     *
     * @throws IllegalArgumentException if the step is not available here or has another type
     */
    public <T> T get(String step, Class<T> type) {
        Object value = outputs.get(step);
        if (value == null) {
            throw new IllegalArgumentException("Output of step " + step + " is not available");
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Output of step " + step + " is a "
                    + value.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public boolean contains(String step) {
        return outputs.containsKey(step);
    }

    public Map<String, Object> asMap() {
        return outputs;
    }
}
