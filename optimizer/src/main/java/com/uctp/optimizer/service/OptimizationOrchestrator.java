package com.uctp.optimizer.service;

import com.uctp.optimizer.advisory.AdvisoryService;
import com.uctp.optimizer.advisory.InterventionSuggestion;
import com.uctp.optimizer.advisory.ProblemSummary;
import com.uctp.optimizer.advisory.TimetableSummaryFormatter;
import com.uctp.optimizer.config.AdvisoryProperties;
import com.uctp.optimizer.config.OptimizerProperties;
import com.uctp.optimizer.engine.FitnessEvaluator;
import com.uctp.optimizer.engine.PopulationInitializer;
import com.uctp.optimizer.engine.RepairEngine;
import com.uctp.optimizer.engine.operator.GridSwaps;
import com.uctp.optimizer.engine.operator.OperatorDispatcher;
import com.uctp.optimizer.model.Candidate;
import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.ConstraintWeights;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import com.uctp.optimizer.strategy.Phase;
import com.uctp.optimizer.strategy.PhaseStrategyController;
import com.uctp.optimizer.strategy.StagnationTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs the phased genetic search for one request and returns the best
 * distinct timetables found.
 *
 * <p>Generations are stepped on the calling thread. Scoring and breeding of
 * a generation fan out to the worker pool, each task with its own generator
 * split from the run's master generator, so a seeded run gives the same
 * result however the tasks are scheduled.
 */
@Service
public class OptimizationOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(OptimizationOrchestrator.class);

    private final PopulationInitializer populationInitializer;
    private final FitnessEvaluator fitnessEvaluator;
    private final RepairEngine repairEngine;
    private final OperatorDispatcher operatorDispatcher;
    private final PhaseStrategyController phaseStrategyController;
    private final AdvisoryService advisoryService;
    private final TimetableSummaryFormatter summaryFormatter;
    private final OptimizerProperties properties;
    private final AdvisoryProperties advisoryProperties;
    private final ExecutorService workerPool;

    public OptimizationOrchestrator(PopulationInitializer populationInitializer,
                                    FitnessEvaluator fitnessEvaluator,
                                    RepairEngine repairEngine,
                                    OperatorDispatcher operatorDispatcher,
                                    PhaseStrategyController phaseStrategyController,
                                    AdvisoryService advisoryService,
                                    TimetableSummaryFormatter summaryFormatter,
                                    OptimizerProperties properties,
                                    AdvisoryProperties advisoryProperties,
                                    @Qualifier("optimizerWorkerPool") ExecutorService workerPool) {
        this.populationInitializer = populationInitializer;
        this.fitnessEvaluator = fitnessEvaluator;
        this.repairEngine = repairEngine;
        this.operatorDispatcher = operatorDispatcher;
        this.phaseStrategyController = phaseStrategyController;
        this.advisoryService = advisoryService;
        this.summaryFormatter = summaryFormatter;
        this.properties = properties;
        this.advisoryProperties = advisoryProperties;
        this.workerPool = workerPool;
    }

    public List<Candidate> optimize(OptimizationRequest request) {
        return optimize(request, CancellationSignal.none(), OptimizationListener.NONE);
    }

    /**
     * @throws com.uctp.optimizer.snapshot.InvalidProblemException when the request
     *         references unknown or malformed data
     * @throws OptimizationException when a worker task fails
     */
    public List<Candidate> optimize(OptimizationRequest request, CancellationSignal cancellation,
                                    OptimizationListener listener) {
        if (properties.getPopulationSize() < 1) {
            throw new IllegalStateException("Population size must be positive, got " + properties.getPopulationSize());
        }
        ProblemSnapshot snapshot = tuneWeights(ProblemSnapshot.from(request));
        SplittableRandom master = properties.getSeed() == null
                ? new SplittableRandom()
                : new SplittableRandom(properties.getSeed());

        List<Phase> phases = phaseStrategyController.resolvePhases(
                ProblemSummary.of(snapshot, properties.getGenerationBudget()));
        logger.info("Optimizing {} sessions over {} batches in {} phases",
                snapshot.totalRequiredSessions(), snapshot.getBatches().size(), phases.size());

        List<TimetableGrid> initial = populationInitializer.initialize(snapshot, properties.getPopulationSize(),
                master.split());
        List<Candidate> population = score(snapshot, initial);

        search:
        for (int phaseIndex = 0; phaseIndex < phases.size(); phaseIndex++) {
            Phase phase = phases.get(phaseIndex);
            StagnationTracker stagnation = new StagnationTracker();
            boolean interventionUsed = false;
            logger.info("Phase {} ({}) for {} generations, heuristics {}",
                    phaseIndex + 1, phase.getName(), phase.getGenerations(), phase.getDistribution());

            for (int generation = 0; generation < phase.getGenerations(); generation++) {
                if (cancellation.isCancelled()) {
                    logger.info("Optimization cancelled in phase {} at generation {}", phase.getName(), generation);
                    break search;
                }
                population.sort(Candidate.BY_SCORE_DESCENDING);
                double bestScore = population.get(0).score();
                int unchanged = stagnation.record(bestScore);
                listener.onGeneration(new GenerationReport(phase.getName(), phaseIndex, generation, bestScore, unchanged));
                logger.debug("Phase {} generation {}: best score {}", phase.getName(), generation, bestScore);

                if (bestScore >= properties.getPerfectScoreThreshold()) {
                    logger.info("Near-perfect score {} reached, stopping", bestScore);
                    break search;
                }
                if (unchanged >= properties.getStagnationLimitExit()) {
                    logger.info("Phase {} stagnated for {} generations, moving on", phase.getName(), unchanged);
                    break;
                }
                if (!interventionUsed
                        && unchanged >= properties.getStagnationLimitIntervention()
                        && generation > properties.getStagnationLimitIntervention()) {
                    interventionUsed = true;
                    if (intervene(snapshot, population, master.split())) {
                        stagnation.reset();
                    }
                }
                population = nextGeneration(snapshot, population, phase, master);
            }
        }

        population.sort(Candidate.BY_SCORE_DESCENDING);
        List<Candidate> candidates = distinctTop(population, snapshot.getCandidateCount());
        logger.info("Returning {} candidates, best score {}", candidates.size(),
                candidates.isEmpty() ? 0 : candidates.get(0).score());
        return candidates;
    }

    private ProblemSnapshot tuneWeights(ProblemSnapshot snapshot) {
        if (snapshot.getFeedbackSamples().size() < advisoryProperties.getMinFeedbackSamples()) {
            return snapshot;
        }
        ConstraintWeights tuned = advisoryService.tuneWeights(snapshot.getWeights(), snapshot.getFeedbackSamples());
        if (tuned.equals(snapshot.getWeights())) {
            return snapshot;
        }
        logger.info("Using tuned weights {}", tuned);
        return snapshot.withWeights(tuned);
    }

    private List<Candidate> nextGeneration(ProblemSnapshot snapshot, List<Candidate> population, Phase phase,
                                           SplittableRandom master) {
        int elites = Math.min(properties.getElitismCount(), population.size());
        List<Candidate> parents = List.copyOf(population);
        List<Callable<Candidate>> tasks = new ArrayList<>();
        for (int i = elites; i < properties.getPopulationSize(); i++) {
            SplittableRandom rng = master.split();
            tasks.add(() -> {
                TimetableGrid offspring = operatorDispatcher.breed(snapshot, parents, phase.getDistribution(), rng);
                repairEngine.repair(snapshot, offspring, rng);
                return new Candidate(offspring, fitnessEvaluator.evaluate(snapshot, offspring));
            });
        }
        List<Candidate> next = new ArrayList<>(population.subList(0, elites));
        next.addAll(runAll(tasks));
        return next;
    }

    /**
     * Asks the advisor for a swap in the best timetable. The repaired result
     * replaces the weakest member of {@code population}, which must be sorted.
     *
     * @return whether the population changed
     */
    boolean intervene(ProblemSnapshot snapshot, List<Candidate> population, SplittableRandom rng) {
        TimetableGrid best = population.get(0).getTimetable();
        logger.info("Search stagnated, asking advisor for an intervention");
        Optional<InterventionSuggestion> suggestion =
                advisoryService.proposeIntervention(summaryFormatter.format(snapshot, best));
        if (suggestion.isEmpty()) {
            return false;
        }
        Optional<ClassAssignment> first = best.findById(suggestion.get().getFirstAssignmentId());
        Optional<ClassAssignment> second = best.findById(suggestion.get().getSecondAssignmentId());
        if (first.isEmpty() || second.isEmpty()) {
            logger.warn("Advisor suggested unknown sessions {}", suggestion.get());
            return false;
        }
        TimetableGrid swapped = best.copy();
        GridSwaps.swapCoordinates(swapped, first.get(), second.get());
        repairEngine.repair(snapshot, swapped, rng);
        population.set(population.size() - 1, new Candidate(swapped, fitnessEvaluator.evaluate(snapshot, swapped)));
        logger.info("Applied advised swap of {} and {}", first.get().getId(), second.get().getId());
        return true;
    }

    private List<Candidate> score(ProblemSnapshot snapshot, List<TimetableGrid> grids) {
        List<Callable<Candidate>> tasks = new ArrayList<>(grids.size());
        for (TimetableGrid grid : grids) {
            tasks.add(() -> new Candidate(grid, fitnessEvaluator.evaluate(snapshot, grid)));
        }
        return runAll(tasks);
    }

    private List<Candidate> runAll(List<Callable<Candidate>> tasks) {
        List<Candidate> results = new ArrayList<>(tasks.size());
        try {
            for (Future<Candidate> future : workerPool.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (ExecutionException e) {
            throw new OptimizationException("Worker task failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OptimizationException("Interrupted while waiting for worker tasks", e);
        }
        return results;
    }

    /** Keeps the first candidate of each distinct timetable content, up to {@code limit}. */
    static List<Candidate> distinctTop(List<Candidate> sorted, int limit) {
        List<Candidate> distinct = new ArrayList<>(limit);
        Set<String> seen = new HashSet<>();
        for (Candidate candidate : sorted) {
            if (distinct.size() >= limit) {
                break;
            }
            if (seen.add(candidate.getTimetable().contentSignature())) {
                distinct.add(candidate);
            }
        }
        return distinct;
    }
}
