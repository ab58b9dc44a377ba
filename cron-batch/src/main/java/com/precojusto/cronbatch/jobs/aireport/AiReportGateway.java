package com.precojusto.cronbatch.jobs.aireport;

/**
 * Collaborators of the AI report job, implemented by the business application.
 * Calls may throw {@link com.precojusto.cronbatch.exception.TransientStepException}
 * for rate limits and provider overload, and
 * {@link com.precojusto.cronbatch.exception.NonRetryableStepException} when the
 * company no longer exists.
 */
public interface AiReportGateway {

    ResearchOutput research(ReportTrigger trigger);

    AnalysisOutput analyze(ReportTrigger trigger, ResearchOutput research);

    CompiledReport compile(ReportTrigger trigger, ResearchOutput research, AnalysisOutput analysis);

    /**
     * Persist the report. Repeated calls with the same idempotency key return the
     * report created by the first one.
     *
     * @return id of the stored report
     */
    String publishReport(ReportTrigger trigger, CompiledReport report, String idempotencyKey);

    /**
     * Flag the company when the report detected a loss of fundamentals.
     */
    void raiseFlag(ReportTrigger trigger, String reportId, String reason);

    /**
     * Queue in-app notifications and emails for the report's subscribers.
     *
     * @return number of subscribers notified
     */
    int notifySubscribers(ReportTrigger trigger, String reportId, String idempotencyKey);
}
