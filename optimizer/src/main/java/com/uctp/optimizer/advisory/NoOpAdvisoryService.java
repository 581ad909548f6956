package com.uctp.optimizer.advisory;

import com.uctp.optimizer.model.ConstraintWeights;
import com.uctp.optimizer.model.FeedbackSample;
import com.uctp.optimizer.model.RankedSubstitute;
import com.uctp.optimizer.strategy.Phase;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** Used when no advisor is configured. */
public class NoOpAdvisoryService implements AdvisoryService {

    @Override
    public List<Phase> proposePhaseStrategy(ProblemSummary summary) {
        return Collections.emptyList();
    }

    @Override
    public Optional<InterventionSuggestion> proposeIntervention(String bestTimetableSummary) {
        return Optional.empty();
    }

    @Override
    public ConstraintWeights tuneWeights(ConstraintWeights current, List<FeedbackSample> feedback) {
        return current;
    }

    @Override
    public List<SubstituteRanking> rankSubstitutes(String sessionDescription, List<RankedSubstitute> candidates) {
        return Collections.emptyList();
    }
}
