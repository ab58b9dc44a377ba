package com.precojusto.cronbatch.support;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.pipeline.FinalizeContext;
import com.precojusto.cronbatch.pipeline.FinalizeResult;
import com.precojusto.cronbatch.pipeline.JobHandler;
import com.precojusto.cronbatch.pipeline.StepContext;
import com.precojusto.cronbatch.pipeline.StepPipeline;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job handler whose steps record their calls and run per-target hooks, keyed
 * {@code "<targetKey>:<step>"}.
 */
public class ScriptedJobHandler implements JobHandler {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Note {
        private String value;
    }

    private final JobType jobType;
    private final StepPipeline pipeline;
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Runnable> hooks = new ConcurrentHashMap<>();

    public ScriptedJobHandler(JobType jobType, String... steps) {
        this.jobType = jobType;
        StepPipeline.Builder builder = StepPipeline.builder(jobType);
        for (String step : steps) {
            builder.step(step, Note.class, context -> execute(step, context));
        }
        this.pipeline = builder.build();
    }

    /**
     * Run {@code hook} when {@code step} executes for {@code targetKey}; use
     * {@code "FINALIZE"} as the step to hook finalization.
     */
    public ScriptedJobHandler on(String targetKey, String step, Runnable hook) {
        hooks.put(targetKey + ":" + step, hook);
        return this;
    }

    public List<String> getCalls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    public long callsFor(String targetKey) {
        return getCalls().stream().filter(call -> call.startsWith(targetKey + ":")).count();
    }

    private Note execute(String step, StepContext context) {
        String target = context.getItem().getTargetKey();
        calls.add(target + ":" + step);
        Runnable hook = hooks.get(target + ":" + step);
        if (hook != null) {
            hook.run();
        }
        return new Note(target + "-" + step);
    }

    @Override
    public JobType getJobType() {
        return jobType;
    }

    @Override
    public StepPipeline getPipeline() {
        return pipeline;
    }

    @Override
    public FinalizeResult finalizeItem(FinalizeContext context) {
        String target = context.getItem().getTargetKey();
        calls.add(target + ":FINALIZE");
        Runnable hook = hooks.get(target + ":FINALIZE");
        if (hook != null) {
            hook.run();
        }
        return FinalizeResult.counted("result-" + target);
    }

    @Override
    public String getCounterName() {
        return "generated";
    }

    @Override
    public int getDefaultBatchSize() {
        return 3;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
