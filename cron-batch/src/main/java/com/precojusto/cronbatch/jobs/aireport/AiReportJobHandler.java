package com.precojusto.cronbatch.jobs.aireport;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.exception.NonRetryableStepException;
import com.precojusto.cronbatch.exception.TransientStepException;
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
 * AI report generation: RESEARCH, ANALYSIS and COMPILATION, then the report is
 * published and subscribers are notified.
 */
@Component
@Slf4j
public class AiReportJobHandler implements JobHandler {

    static final String RESEARCH = "RESEARCH";
    static final String ANALYSIS = "ANALYSIS";
    static final String COMPILATION = "COMPILATION";

    private static final Set<String> WEAK_ASSESSMENTS = Set.of("FRACO", "EM_DETERIORACAO");

    private final ObjectProvider<AiReportGateway> gatewayProvider;
    private final BackoffRetrier retrier;
    private final StepPipeline pipeline;

    public AiReportJobHandler(ObjectProvider<AiReportGateway> gatewayProvider, BackoffRetrier retrier) {
        this.gatewayProvider = gatewayProvider;
        this.retrier = retrier;
        this.pipeline = StepPipeline.builder(JobType.AI_REPORT)
                .step(RESEARCH, ResearchOutput.class, this::research)
                .step(ANALYSIS, AnalysisOutput.class, this::analyze)
                .step(COMPILATION, CompiledReport.class, this::compile)
                .build();
    }

    @Override
    public JobType getJobType() {
        return JobType.AI_REPORT;
    }

    @Override
    public StepPipeline getPipeline() {
        return pipeline;
    }

    @Override
    public String getCounterName() {
        return "reportsGenerated";
    }

    @Override
    public int getDefaultBatchSize() {
        return 5;
    }

    @Override
    public boolean isAvailable() {
        return gatewayProvider.getIfAvailable() != null;
    }

    private ResearchOutput research(StepContext context) {
        ReportTrigger trigger = trigger(context.payload(ReportTrigger.class));
        if (trigger.getReportType() != ReportType.PRICE_VARIATION) {
            return ResearchOutput.notRequired();
        }
        return retrier.call("research " + trigger.getTicker(), () -> gateway().research(trigger));
    }

    private AnalysisOutput analyze(StepContext context) {
        ReportTrigger trigger = trigger(context.payload(ReportTrigger.class));
        if (trigger.getReportType() != ReportType.PRICE_VARIATION) {
            return AnalysisOutput.notRequired();
        }
        ResearchOutput research = context.output(RESEARCH, ResearchOutput.class);
        return retrier.call("analysis " + trigger.getTicker(), () -> gateway().analyze(trigger, research));
    }

    private CompiledReport compile(StepContext context) {
        ReportTrigger trigger = trigger(context.payload(ReportTrigger.class));
        ResearchOutput research = context.output(RESEARCH, ResearchOutput.class);
        AnalysisOutput analysis = context.output(ANALYSIS, AnalysisOutput.class);

        CompiledReport report = retrier.call("compilation " + trigger.getTicker(), () -> {
            CompiledReport compiled = gateway().compile(trigger, research, analysis);
            if (compiled == null || compiled.getContent() == null || compiled.getContent().isBlank()) {
                throw new TransientStepException("Empty report content for " + trigger.getTicker());
            }
            return compiled;
        });

        report.setFundamentalLoss(analysis.isFundamentalLoss());
        report.setConclusion(analysis.getConclusion() != null ? analysis.getConclusion() : "ANALISE_INDISPONIVEL");
        report.setAssessment(analysis.getAssessment());
        return report;
    }

    @Override
    public FinalizeResult finalizeItem(FinalizeContext context) {
        ReportTrigger trigger = trigger(context.payload(ReportTrigger.class));
        CompiledReport report = context.output(COMPILATION, CompiledReport.class);
        AiReportGateway gateway = gateway();

        String reportId = gateway.publishReport(trigger, report, context.getIdempotencyKey());

        if (trigger.getReportType() == ReportType.PRICE_VARIATION && shouldFlag(report)) {
            gateway.raiseFlag(trigger, reportId, flagReason(report));
        }

        int notified = gateway.notifySubscribers(trigger, reportId, context.getIdempotencyKey());
        log.info("Report {} generated for {}, {} subscriber(s) notified", reportId, trigger.getTicker(), notified);

        return FinalizeResult.counted(reportId);
    }

    private boolean shouldFlag(CompiledReport report) {
        return report.isFundamentalLoss()
                || (report.getAssessment() != null && WEAK_ASSESSMENTS.contains(report.getAssessment()));
    }

    private String flagReason(CompiledReport report) {
        if ("FRACO".equals(report.getAssessment())) {
            return "Fundamentos fracos detectados. " + report.getConclusion();
        }
        if ("EM_DETERIORACAO".equals(report.getAssessment())) {
            return "Fundamentos em deterioracao detectados. " + report.getConclusion();
        }
        return report.getConclusion();
    }

    private ReportTrigger trigger(ReportTrigger trigger) {
        if (trigger.getCompanyId() == null || trigger.getReportType() == null) {
            throw new NonRetryableStepException("Report trigger without company or report type");
        }
        return trigger;
    }

    private AiReportGateway gateway() {
        return gatewayProvider.getObject();
    }
}
