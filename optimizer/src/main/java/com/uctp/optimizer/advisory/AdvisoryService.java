package com.uctp.optimizer.advisory;

import com.uctp.optimizer.model.ConstraintWeights;
import com.uctp.optimizer.model.FeedbackSample;
import com.uctp.optimizer.model.RankedSubstitute;
import com.uctp.optimizer.strategy.Phase;

import java.util.List;
import java.util.Optional;

/**
 * Optional outside advice for a run. Every method is best-effort: callers
 * treat an empty answer, or unchanged weights, as "no advice".
 */
public interface AdvisoryService {

    /** @return an advised phase plan, or an empty list to use the default plan */
    List<Phase> proposePhaseStrategy(ProblemSummary summary);

    /**
     * @param bestTimetableSummary one line per session of the current best timetable
     * @return two session ids to swap, if the advisor has an idea
     */
    Optional<InterventionSuggestion> proposeIntervention(String bestTimetableSummary);

    ConstraintWeights tuneWeights(ConstraintWeights current, List<FeedbackSample> feedback);

    /**
     * @param sessionDescription the session needing cover, in plain words
     * @param candidates         free faculty, already ranked by workload and fit
     * @return the advisor's ranking, or an empty list to keep the given order
     */
    List<SubstituteRanking> rankSubstitutes(String sessionDescription, List<RankedSubstitute> candidates);
}
