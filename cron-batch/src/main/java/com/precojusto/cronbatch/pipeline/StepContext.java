package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.domain.WorkItem;
import lombok.Getter;

import java.util.List;
import java.util.function.Consumer;

/**
 * Inputs available to a step function: the item, its payload, the outputs of the
 * steps it depends on, and the time budget of the invocation.
 */
public class StepContext {

    @Getter
    private final WorkItem item;

    @Getter
    private final String stepName;

    private final StepOutputs dependencies;
    private final CheckpointCodec codec;

    @Getter
    private final TimeBudget budget;

    private final SubTaskRunner subTaskRunner;

    public StepContext(WorkItem item, String stepName, StepOutputs dependencies, CheckpointCodec codec,
            TimeBudget budget, SubTaskRunner subTaskRunner) {
        this.item = item;
        this.stepName = stepName;
        this.dependencies = dependencies;
        this.codec = codec;
        this.budget = budget;
        this.subTaskRunner = subTaskRunner;
    }

    /**
     * The trigger payload of the item.
     */
    public <T> T payload(Class<T> type) {
        return codec.decode(item.getPayloadJson(), type, "payload of work item " + item.getId());
    }

    /**
     * Output of a step this step declared as a dependency.
     */
    public <T> T output(String step, Class<T> type) {
        return dependencies.get(step, type);
    }

    /**
     * Process the outstanding sub-units of this step one at a time, persisting a
     * cursor after each. Stops with a {@link com.precojusto.cronbatch.exception.StepInterruptedException}
     * when the budget runs out between sub-units.
     *
     * @param outstandingUnits sub-unit identifiers still to do, in ascending processing order
     * @param unitWork         work for one sub-unit
     * @return number of sub-units processed by this call
     */
    public int runSubTasks(List<String> outstandingUnits, Consumer<String> unitWork) {
        return subTaskRunner.run(item.getJobType(), item.scopeId(), stepName, outstandingUnits, unitWork, budget);
    }
}
