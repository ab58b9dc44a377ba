package com.precojusto.cronbatch.jobs.index;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.exception.TransientStepException;
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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Daily mark-to-market of every index. The single step first backfills missing
 * history one trading day at a time, then computes the points of the business date.
 */
@Component
@Slf4j
public class MarkToMarketJobHandler implements DailySweepJobHandler {

    static final String MARK_TO_MARKET = "MARK_TO_MARKET";

    private final ObjectProvider<MarkToMarketGateway> gatewayProvider;
    private final BackoffRetrier retrier;
    private final StepPipeline pipeline;

    public MarkToMarketJobHandler(ObjectProvider<MarkToMarketGateway> gatewayProvider, BackoffRetrier retrier) {
        this.gatewayProvider = gatewayProvider;
        this.retrier = retrier;
        this.pipeline = StepPipeline.builder(JobType.INDEX_MARK_TO_MARKET)
                .step(MARK_TO_MARKET, MarkToMarketOutput.class, this::markToMarket)
                .build();
    }

    @Override
    public JobType getJobType() {
        return JobType.INDEX_MARK_TO_MARKET;
    }

    @Override
    public StepPipeline getPipeline() {
        return pipeline;
    }

    @Override
    public String getCounterName() {
        return "updated";
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

    private MarkToMarketOutput markToMarket(StepContext context) {
        SweepPayload payload = context.payload(SweepPayload.class);
        String indexId = payload.getTarget();
        LocalDate businessDate = payload.getBusinessDate();
        MarkToMarketGateway gateway = gateway();

        if (gateway.hasPointFor(indexId, businessDate)) {
            log.info("Index {} already up to date for {}, skipping", indexId, businessDate);
            return MarkToMarketOutput.builder()
                    .indexId(indexId)
                    .businessDate(businessDate)
                    .alreadyUpToDate(true)
                    .build();
        }

        List<String> missingDays = gateway.missingHistoryDates(indexId, businessDate).stream()
                .map(LocalDate::toString)
                .collect(Collectors.toList());
        int filled = context.runSubTasks(missingDays,
                day -> retrier.run("fill " + indexId + " " + day,
                        () -> gateway.fillHistory(indexId, LocalDate.parse(day))));
        if (filled > 0) {
            log.info("Index {}: filled {} missing day(s)", indexId, filled);
        }

        BigDecimal points = retrier.call("points " + indexId, () -> gateway.updatePoints(indexId, businessDate));
        if (points == null) {
            throw new TransientStepException("Failed to update points of index " + indexId);
        }

        return MarkToMarketOutput.builder()
                .indexId(indexId)
                .businessDate(businessDate)
                .filledDays(filled)
                .points(points)
                .build();
    }

    @Override
    public FinalizeResult finalizeItem(FinalizeContext context) {
        MarkToMarketOutput output = context.output(MARK_TO_MARKET, MarkToMarketOutput.class);
        log.info("Index {} marked to market for {}{}", output.getIndexId(), output.getBusinessDate(),
                output.isAlreadyUpToDate() ? " (already up to date)" : ": " + output.getPoints());
        return FinalizeResult.counted(SweepPayload.targetKey(output.getIndexId(), output.getBusinessDate()));
    }

    private MarkToMarketGateway gateway() {
        return gatewayProvider.getObject();
    }
}
