package com.precojusto.cronbatch.pipeline;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One named stage of a pipeline. The output type is the shape its checkpoint
 * decodes into, so consumers read a dependency's output without casting a raw map.
 *
 * @param <O> step output type
 */
@Getter
public class StepDefinition<O> {

    private final String name;
    private final int ordinal;
    private final Set<String> dependsOn;
    private final Class<O> outputType;
    private final StepFunction<O> function;

    StepDefinition(String name, int ordinal, Set<String> dependsOn, Class<O> outputType, StepFunction<O> function) {
        this.name = name;
        this.ordinal = ordinal;
        this.dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
        this.outputType = outputType;
        this.function = function;
    }

    @Override
    public String toString() {
        return name + "#" + ordinal;
    }
}
