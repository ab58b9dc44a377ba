package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.StepCheckpoint;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.exception.MissingCheckpointException;
import com.precojusto.cronbatch.infrastructure.CheckpointStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executes a single step of an item: loads its dependencies, runs the step
 * function and stores the output as the step's checkpoint.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StepRunner {

    private final CheckpointStore checkpointStore;
    private final CheckpointCodec codec;
    private final SubTaskRunner subTaskRunner;

    /**
     * Run a step unless it already has a checkpoint.
     *
     * @return true if the step function was invoked
     */
    public boolean run(StepPipeline pipeline, StepDefinition<?> step, WorkItem item, TimeBudget budget) {
        JobType jobType = pipeline.getJobType();
        String scopeId = item.scopeId();

        if (checkpointStore.load(jobType, scopeId, step.getName()).isPresent()) {
            log.info("Step {} already checkpointed for item {}, skipping", step.getName(), item.getId());
            return false;
        }

        StepOutputs dependencies = loadDependencies(pipeline, step, item);
        StepContext context = new StepContext(item, step.getName(), dependencies, codec, budget, subTaskRunner);

        long startedAt = System.currentTimeMillis();
        Object output = step.getFunction().execute(context);

        checkpointStore.save(jobType, scopeId, step.getName(),
                codec.encode(output, "output of step " + step.getName()));

        log.info("Step {} completed for item {} in {}ms", step.getName(), item.getId(),
                System.currentTimeMillis() - startedAt);
        return true;
    }

    /**
     * Decode the outputs of every checkpointed step of an item.
     *
     * @throws MissingCheckpointException if any step of the pipeline has no checkpoint
     */
    public StepOutputs loadAll(StepPipeline pipeline, WorkItem item) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (StepDefinition<?> step : pipeline.getSteps()) {
            outputs.put(step.getName(), loadOutput(pipeline, step, item, "FINALIZE"));
        }
        return new StepOutputs(outputs);
    }

    private StepOutputs loadDependencies(StepPipeline pipeline, StepDefinition<?> step, WorkItem item) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (String dependency : step.getDependsOn()) {
            StepDefinition<?> definition = pipeline.step(dependency)
                    .orElseThrow(() -> new IllegalStateException("Unknown dependency " + dependency));
            outputs.put(dependency, loadOutput(pipeline, definition, item, step.getName()));
        }
        return new StepOutputs(outputs);
    }

    private Object loadOutput(StepPipeline pipeline, StepDefinition<?> definition, WorkItem item, String consumer) {
        Optional<StepCheckpoint> checkpoint = checkpointStore.load(pipeline.getJobType(), item.scopeId(),
                definition.getName());
        if (checkpoint.isEmpty()) {
            throw new MissingCheckpointException(pipeline.getJobType(), item.scopeId(), consumer,
                    definition.getName());
        }
        return codec.decode(checkpoint.get().getDataJson(), definition.getOutputType(),
                "checkpoint " + definition.getName() + " of item " + item.getId());
    }
}
