package com.uctp.optimizer.advisory;

import com.uctp.optimizer.model.ConstraintWeights;
import com.uctp.optimizer.model.FeedbackSample;
import com.uctp.optimizer.model.RankedSubstitute;
import com.uctp.optimizer.strategy.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every call of the wrapped advisor on its own executor under a timeout.
 * Failures, timeouts and malformed answers are logged and replaced by the
 * "no advice" answer, so nothing thrown by the advisor reaches the engine.
 */
public class GuardedAdvisoryService implements AdvisoryService {
    private static final Logger logger = LoggerFactory.getLogger(GuardedAdvisoryService.class);

    private final AdvisoryService delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public GuardedAdvisoryService(AdvisoryService delegate, ExecutorService executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public List<Phase> proposePhaseStrategy(ProblemSummary summary) {
        List<Phase> phases = call("phase strategy", () -> delegate.proposePhaseStrategy(summary));
        return phases == null ? Collections.emptyList() : phases;
    }

    @Override
    public Optional<InterventionSuggestion> proposeIntervention(String bestTimetableSummary) {
        Optional<InterventionSuggestion> suggestion =
                call("intervention", () -> delegate.proposeIntervention(bestTimetableSummary));
        return suggestion == null ? Optional.empty() : suggestion;
    }

    @Override
    public ConstraintWeights tuneWeights(ConstraintWeights current, List<FeedbackSample> feedback) {
        ConstraintWeights tuned = call("weight tuning", () -> delegate.tuneWeights(current, feedback));
        if (tuned == null) {
            return current;
        }
        if (!tuned.isValid()) {
            logger.warn("Advisor proposed invalid weights {}, keeping {}", tuned, current);
            return current;
        }
        return tuned;
    }

    @Override
    public List<SubstituteRanking> rankSubstitutes(String sessionDescription, List<RankedSubstitute> candidates) {
        List<SubstituteRanking> rankings =
                call("substitute ranking", () -> delegate.rankSubstitutes(sessionDescription, candidates));
        return rankings == null ? Collections.emptyList() : rankings;
    }

    private <T> T call(String operation, Callable<T> task) {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            logger.warn("Advisory {} skipped: executor rejected the call", operation);
            return null;
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Advisory {} timed out after {} ms", operation, timeout.toMillis());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for advisory {}", operation);
        } catch (ExecutionException e) {
            logger.warn("Advisory {} failed: {}", operation, String.valueOf(e.getCause()));
        }
        return null;
    }
}
