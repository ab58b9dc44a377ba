package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.domain.JobType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered list of steps a work item of one job type passes through.
 */
public class StepPipeline {

    private final JobType jobType;
    private final List<StepDefinition<?>> steps;

    private StepPipeline(JobType jobType, List<StepDefinition<?>> steps) {
        this.jobType = jobType;
        this.steps = Collections.unmodifiableList(steps);
    }

    public static Builder builder(JobType jobType) {
        return new Builder(jobType);
    }

    public JobType getJobType() {
        return jobType;
    }

    public List<StepDefinition<?>> getSteps() {
        return steps;
    }

    /**
     * First step, in pipeline order, that has no checkpoint.
     *
     * @param completedSteps names of the checkpointed steps
     * @return the next step, or empty when the item is ready for finalization
     */
    public Optional<StepDefinition<?>> nextStep(Set<String> completedSteps) {
        return steps.stream()
                .filter(step -> !completedSteps.contains(step.getName()))
                .findFirst();
    }

    public Optional<StepDefinition<?>> step(String name) {
        return steps.stream()
                .filter(step -> step.getName().equals(name))
                .findFirst();
    }

    public static class Builder {

        private final JobType jobType;
        private final List<StepDefinition<?>> steps = new ArrayList<>();

        private Builder(JobType jobType) {
            this.jobType = jobType;
        }

        /**
         * Add a step that consumes the outputs of every step before it.
         */
        public <O> Builder step(String name, Class<O> outputType, StepFunction<O> function) {
            Set<String> prior = new LinkedHashSet<>();
            steps.forEach(step -> prior.add(step.getName()));
            return step(name, outputType, prior, function);
        }

        /**
         * Add a step with an explicit set of dependencies, all of which must
         * already be part of the pipeline.
         */
        public <O> Builder step(String name, Class<O> outputType, Set<String> dependsOn, StepFunction<O> function) {
            if (steps.stream().anyMatch(step -> step.getName().equals(name))) {
                throw new IllegalArgumentException("Duplicate step " + name + " in " + jobType + " pipeline");
            }
            for (String dependency : dependsOn) {
                if (steps.stream().noneMatch(step -> step.getName().equals(dependency))) {
                    throw new IllegalArgumentException(
                            "Step " + name + " depends on " + dependency + ", which does not precede it");
                }
            }
            steps.add(new StepDefinition<>(name, steps.size(), dependsOn, outputType, function));
            return this;
        }

        public StepPipeline build() {
            if (steps.isEmpty()) {
                throw new IllegalStateException("Pipeline for " + jobType + " has no steps");
            }
            return new StepPipeline(jobType, new ArrayList<>(steps));
        }
    }
}
