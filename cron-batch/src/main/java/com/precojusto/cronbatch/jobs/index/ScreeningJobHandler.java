package com.precojusto.cronbatch.jobs.index;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.pipeline.BackoffRetrier;
import com.precojusto.cronbatch.pipeline.DailySweepJobHandler;
import com.precojusto.cronbatch.pipeline.FinalizeContext;
import com.precojusto.cronbatch.pipeline.FinalizeResult;
import com.precojusto.cronbatch.pipeline.StepContext;
import com.precojusto.cronbatch.pipeline.StepPipeline;
import com.precojusto.cronbatch.pipeline.SweepPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Daily screening of every index: SCREENING, then REBALANCE_DECISION. The new
 * composition is applied at finalization when a rebalance is due.
 */
@Component
@Slf4j
public class ScreeningJobHandler implements DailySweepJobHandler {

    static final String SCREENING = "SCREENING";
    static final String REBALANCE_DECISION = "REBALANCE_DECISION";

    private final ObjectProvider<ScreeningGateway> gatewayProvider;
    private final BackoffRetrier retrier;
    private final StepPipeline pipeline;

    public ScreeningJobHandler(ObjectProvider<ScreeningGateway> gatewayProvider, BackoffRetrier retrier) {
        this.gatewayProvider = gatewayProvider;
        this.retrier = retrier;
        this.pipeline = StepPipeline.builder(JobType.INDEX_SCREENING)
                .step(SCREENING, ScreeningOutput.class, this::screen)
                .step(REBALANCE_DECISION, RebalanceDecision.class, this::decide)
                .build();
    }

    @Override
    public JobType getJobType() {
        return JobType.INDEX_SCREENING;
    }

    @Override
    public StepPipeline getPipeline() {
        return pipeline;
    }

    @Override
    public String getCounterName() {
        return "rebalanced";
    }

    @Override
    public int getDefaultBatchSize() {
        return 50;
    }

    @Override
    public boolean isAvailable() {
        return gatewayProvider.getIfAvailable() != null;
    }

    @Override
    public List<String> targets(LocalDate businessDate) {
        return gateway().activeIndexIds();
    }

    private ScreeningOutput screen(StepContext context) {
        SweepPayload payload = context.payload(SweepPayload.class);
        String indexId = payload.getTarget();
        LocalDate businessDate = payload.getBusinessDate();

        if (gateway().screenedOn(indexId, businessDate)) {
            log.info("Index {} already screened on {}, skipping", indexId, businessDate);
            return ScreeningOutput.builder()
                    .indexId(indexId)
                    .businessDate(businessDate)
                    .alreadyScreened(true)
                    .build();
        }

        ScreeningOutput output = retrier.call("screening " + indexId, () -> gateway().screen(indexId, businessDate));
        output.setIndexId(indexId);
        output.setBusinessDate(businessDate);
        if (!output.getQualityRejected().isEmpty()) {
            log.info("Index {}: {} companies filtered out by quality check ({} remain)", indexId,
                    output.getQualityRejected().size(), output.getCandidates().size());
        }
        return output;
    }

    private RebalanceDecision decide(StepContext context) {
        ScreeningOutput screening = context.output(SCREENING, ScreeningOutput.class);

        if (screening.isAlreadyScreened()) {
            return RebalanceDecision.keep("Already screened today");
        }
        if (screening.getCandidates().isEmpty()) {
            return RebalanceDecision.keep(screening.getQualityRejected().isEmpty()
                    ? "Rebalance routine ran: no company found in screening"
                    : "Rebalance routine ran: no company passed the quality check");
        }

        RebalanceDecision decision = retrier.call("rebalance decision " + screening.getIndexId(),
                () -> gateway().decide(screening.getIndexId(), screening));
        if (!decision.isRebalance() || decision.getChanges().isEmpty()) {
            log.info("Index {}: no rebalancing needed ({} potential change(s))", screening.getIndexId(),
                    decision.getChanges().size());
        }
        return decision;
    }

    @Override
    public FinalizeResult finalizeItem(FinalizeContext context) {
        ScreeningOutput screening = context.output(SCREENING, ScreeningOutput.class);
        RebalanceDecision decision = context.output(REBALANCE_DECISION, RebalanceDecision.class);
        String indexId = screening.getIndexId();

        if (decision.isRebalance() && !decision.getChanges().isEmpty()) {
            String logId = gateway().applyRebalance(indexId, decision, context.getIdempotencyKey());
            log.info("Index {} rebalanced ({} changes): {}", indexId, decision.getChanges().size(),
                    decision.getReason());
            return FinalizeResult.counted(logId);
        }

        if (!screening.isAlreadyScreened()) {
            String message = decision.getReason() != null
                    ? decision.getReason()
                    : "Rebalance routine ran: no change needed after screening";
            gateway().logScreening(indexId, screening.getBusinessDate(), message);
        }
        return FinalizeResult.notCounted(SweepPayload.targetKey(indexId, screening.getBusinessDate()));
    }

    private ScreeningGateway gateway() {
        return gatewayProvider.getObject();
    }
}
