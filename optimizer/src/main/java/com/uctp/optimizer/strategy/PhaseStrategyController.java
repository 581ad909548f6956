package com.uctp.optimizer.strategy;

import com.uctp.optimizer.advisory.AdvisoryService;
import com.uctp.optimizer.advisory.ProblemSummary;
import com.uctp.optimizer.config.OptimizerProperties;
import com.uctp.optimizer.engine.operator.HeuristicDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides the phase plan of a run: an advised plan when the advisory service
 * offers a sane one, the exploration/balanced/exploitation default otherwise.
 */
@Component
public class PhaseStrategyController {
    private static final Logger logger = LoggerFactory.getLogger(PhaseStrategyController.class);

    private final AdvisoryService advisoryService;
    private final OptimizerProperties properties;

    public PhaseStrategyController(AdvisoryService advisoryService, OptimizerProperties properties) {
        this.advisoryService = advisoryService;
        this.properties = properties;
    }

    public List<Phase> resolvePhases(ProblemSummary summary) {
        List<Phase> advised = advisoryService.proposePhaseStrategy(summary);
        if (isAcceptable(advised)) {
            logger.info("Using advised phase plan with {} phases", advised.size());
            return advised;
        }
        if (!advised.isEmpty()) {
            logger.warn("Rejected advised phase plan {}, falling back to default", advised);
        }
        return defaultPhases(properties.getGenerationBudget());
    }

    /**
     * Splits {@code generationBudget} 40/40/20 over three phases. Phases that
     * round down to zero generations are left out.
     */
    public List<Phase> defaultPhases(int generationBudget) {
        int exploration = (int) Math.round(generationBudget * 0.4);
        int balanced = (int) Math.round(generationBudget * 0.4);
        int exploitation = Math.max(0, generationBudget - exploration - balanced);

        List<Phase> phases = new ArrayList<>(3);
        addIfPositive(phases, "exploration", exploration, HeuristicDistribution.of(0.1, 0.4, 0.0, 0.5));
        addIfPositive(phases, "balanced", balanced, HeuristicDistribution.of(0.5, 0.2, 0.1, 0.2));
        addIfPositive(phases, "exploitation", exploitation, HeuristicDistribution.of(0.4, 0.1, 0.5, 0.0));
        return phases;
    }

    boolean isAcceptable(List<Phase> phases) {
        if (phases == null || phases.isEmpty()) {
            return false;
        }
        int total = 0;
        for (Phase phase : phases) {
            if (phase.getGenerations() <= 0 || phase.getDistribution() == null) {
                return false;
            }
            total += phase.getGenerations();
        }
        return total <= properties.getMaxAdvisedGenerations();
    }

    private static void addIfPositive(List<Phase> phases, String name, int generations,
                                      HeuristicDistribution distribution) {
        if (generations > 0) {
            phases.add(new Phase(name, generations, distribution));
        }
    }
}
