package com.precojusto.cronbatch.jobs.flag;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.exception.NonRetryableStepException;
import com.precojusto.cronbatch.pipeline.BackoffRetrier;
import com.precojusto.cronbatch.pipeline.FinalizeContext;
import com.precojusto.cronbatch.pipeline.FinalizeResult;
import com.precojusto.cronbatch.pipeline.JobHandler;
import com.precojusto.cronbatch.pipeline.StepContext;
import com.precojusto.cronbatch.pipeline.StepPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Company flag reevaluation. The item's target key is the flag id.
 */
@Component
@Slf4j
public class FlagReevaluationJobHandler implements JobHandler {

    static final String RESEARCH = "RESEARCH";
    static final String ANALYSIS = "ANALYSIS";
    static final String EVALUATION = "EVALUATION";

    private final ObjectProvider<FlagReevaluationGateway> gatewayProvider;
    private final BackoffRetrier retrier;
    private final StepPipeline pipeline;

    public FlagReevaluationJobHandler(ObjectProvider<FlagReevaluationGateway> gatewayProvider,
            BackoffRetrier retrier) {
        this.gatewayProvider = gatewayProvider;
        this.retrier = retrier;
        this.pipeline = StepPipeline.builder(JobType.FLAG_REEVALUATION)
                .step(RESEARCH, CurrentConditions.class, Set.of(), this::research)
                .step(ANALYSIS, FlagAnalysis.class, Set.of(RESEARCH), this::analyze)
                .step(EVALUATION, FlagEvaluation.class, Set.of(ANALYSIS), this::evaluate)
                .build();
    }

    @Override
    public JobType getJobType() {
        return JobType.FLAG_REEVALUATION;
    }

    @Override
    public StepPipeline getPipeline() {
        return pipeline;
    }

    @Override
    public String getCounterName() {
        return "reevaluated";
    }

    @Override
    public int getDefaultBatchSize() {
        return 5;
    }

    @Override
    public boolean isAvailable() {
        return gatewayProvider.getIfAvailable() != null;
    }

    private CurrentConditions research(StepContext context) {
        FlagSnapshot flag = flag(context.getItem().getTargetKey());
        log.info("Researching current conditions of {}", flag.getTicker());
        return retrier.call("research " + flag.getTicker(), () -> gateway().researchCurrentConditions(flag));
    }

    private FlagAnalysis analyze(StepContext context) {
        FlagSnapshot flag = flag(context.getItem().getTargetKey());
        CurrentConditions conditions = context.output(RESEARCH, CurrentConditions.class);
        log.info("Analyzing flag relevance for {}", flag.getTicker());
        return retrier.call("analysis " + flag.getTicker(), () -> gateway().analyzeRelevance(flag, conditions));
    }

    private FlagEvaluation evaluate(StepContext context) {
        FlagSnapshot flag = flag(context.getItem().getTargetKey());
        FlagAnalysis analysis = context.output(ANALYSIS, FlagAnalysis.class);
        log.info("Evaluating final flag status for {}", flag.getTicker());
        return retrier.call("evaluation " + flag.getTicker(), () -> gateway().evaluate(flag, analysis));
    }

    @Override
    public FinalizeResult finalizeItem(FinalizeContext context) {
        FlagSnapshot flag = flag(context.getItem().getTargetKey());
        FlagEvaluation evaluation = context.output(EVALUATION, FlagEvaluation.class);

        gateway().applyEvaluation(flag, evaluation, context.getIdempotencyKey());

        log.info("Flag {} ({}) {}", flag.getFlagId(), flag.getTicker(),
                evaluation.isShouldKeepActive() ? "kept active" : "deactivated");
        return FinalizeResult.counted(flag.getFlagId());
    }

    private FlagSnapshot flag(String flagId) {
        return gateway().findFlag(flagId)
                .orElseThrow(() -> new NonRetryableStepException("Flag " + flagId + " not found"));
    }

    private FlagReevaluationGateway gateway() {
        return gatewayProvider.getObject();
    }
}
