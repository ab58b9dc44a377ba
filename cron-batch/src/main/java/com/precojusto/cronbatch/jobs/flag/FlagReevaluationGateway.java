package com.precojusto.cronbatch.jobs.flag;

import java.util.Optional;

/**
 * Collaborators of the flag reevaluation job, implemented by the business application.
 */
public interface FlagReevaluationGateway {

    Optional<FlagSnapshot> findFlag(String flagId);

    CurrentConditions researchCurrentConditions(FlagSnapshot flag);

    FlagAnalysis analyzeRelevance(FlagSnapshot flag, CurrentConditions conditions);

    FlagEvaluation evaluate(FlagSnapshot flag, FlagAnalysis analysis);

    /**
     * Apply the verdict: activate or deactivate the flag, update its reason and
     * bump its reevaluation count. Repeated calls with the same idempotency key
     * apply it once.
     */
    void applyEvaluation(FlagSnapshot flag, FlagEvaluation evaluation, String idempotencyKey);
}
