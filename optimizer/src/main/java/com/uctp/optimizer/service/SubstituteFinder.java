package com.uctp.optimizer.service;

import com.uctp.optimizer.advisory.AdvisoryService;
import com.uctp.optimizer.advisory.SubstituteRanking;
import com.uctp.optimizer.engine.AvailabilityOracle;
import com.uctp.optimizer.engine.FitnessEvaluator;
import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.Faculty;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.model.RankedSubstitute;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks the faculty members who could cover one session of a timetable,
 * for instance when its faculty member goes on leave.
 *
 * <p>Candidates must be free at the session's time, by availability, planned
 * leave and existing bookings alike. The built-in ranking favours, in this
 * order, teaching the session's subject, an allocation to the same batch, a
 * light week and a compact day. A configured advisor may re-rank the list;
 * candidates it leaves out follow in the built-in order.
 */
@Service
public class SubstituteFinder {
    private static final Logger logger = LoggerFactory.getLogger(SubstituteFinder.class);

    static final int SUBJECT_POINTS = 40;
    static final int ALLOCATION_POINTS = 30;
    static final int WORKLOAD_POINTS = 20;
    static final int COMPACTNESS_POINTS = 10;

    private static final Comparator<RankedSubstitute> BY_RANK =
            Comparator.comparingInt(RankedSubstitute::getScore).reversed()
                    .thenComparingInt(RankedSubstitute::getWorkload)
                    .thenComparing(candidate -> candidate.getFaculty().getId());

    private final AvailabilityOracle oracle;
    private final AdvisoryService advisoryService;

    public SubstituteFinder(AvailabilityOracle oracle, AdvisoryService advisoryService) {
        this.oracle = oracle;
        this.advisoryService = advisoryService;
    }

    /**
     * @throws com.uctp.optimizer.snapshot.InvalidProblemException when the request is malformed
     * @throws IllegalArgumentException when {@code timetable} has no session {@code assignmentId}
     */
    public List<RankedSubstitute> findSubstitutes(OptimizationRequest request, TimetableGrid timetable,
                                                  String assignmentId) {
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        ClassAssignment target = timetable.findById(assignmentId)
                .orElseThrow(() -> new IllegalArgumentException("No session '" + assignmentId + "' in the timetable"));
        Subject subject = snapshot.subject(target.getSubjectId());
        Batch batch = snapshot.batch(target.getBatchId());
        Set<String> allocatedToBatch = request.getFacultyAllocations().stream()
                .filter(allocation -> allocation.getBatchId().equals(batch.getId()))
                .flatMap(allocation -> allocation.getFacultyIds().stream())
                .collect(Collectors.toSet());

        List<RankedSubstitute> candidates = new ArrayList<>();
        for (Faculty member : snapshot.getFaculty()) {
            if (target.isTaughtBy(member.getId()) || member.getSubjectIds().isEmpty()) {
                continue;
            }
            if (!oracle.facultyFree(snapshot, timetable, member.getId(), target.getDay(), target.getSlot())) {
                continue;
            }
            candidates.add(RankedSubstitute.builder()
                    .faculty(member)
                    .suitableSubjectIds(member.getSubjectIds())
                    .canTeachOriginal(member.isQualifiedFor(subject.getId()))
                    .allocatedToBatch(allocatedToBatch.contains(member.getId()))
                    .workload(workload(timetable, member.getId()))
                    .scheduleGaps(gapsWith(timetable, member.getId(), target))
                    .build());
        }
        if (candidates.isEmpty()) {
            logger.info("No free substitute for session {}", assignmentId);
            return candidates;
        }

        List<RankedSubstitute> ranked = rank(candidates);
        String description = String.format("the class \"%s\" for batch \"%s\" on %s at slot %d",
                subject.getName(), batch.getName(), snapshot.getGeometry().dayName(target.getDay()), target.getSlot());
        List<SubstituteRanking> advice = advisoryService.rankSubstitutes(description, ranked);
        if (advice.isEmpty()) {
            return ranked;
        }
        return applyAdvice(ranked, advice);
    }

    static List<RankedSubstitute> rank(List<RankedSubstitute> candidates) {
        int lightest = candidates.stream().mapToInt(RankedSubstitute::getWorkload).min().orElse(0);
        List<RankedSubstitute> ranked = new ArrayList<>(candidates.size());
        for (RankedSubstitute candidate : candidates) {
            RankedSubstitute.RankedSubstituteBuilder builder = candidate.toBuilder()
                    .clearReasons()
                    .reason("Availability confirmed");
            int score = 0;
            if (candidate.isCanTeachOriginal()) {
                score += SUBJECT_POINTS;
                builder.reason("Can teach the original subject");
            }
            if (candidate.isAllocatedToBatch()) {
                score += ALLOCATION_POINTS;
                builder.reason("Already allocated to this batch");
            }
            score += WORKLOAD_POINTS / (1 + candidate.getWorkload());
            if (candidate.getWorkload() == lightest) {
                builder.reason("Has the lightest workload this week");
            }
            score += COMPACTNESS_POINTS / (1 + candidate.getScheduleGaps());
            if (candidate.getScheduleGaps() == 0) {
                builder.reason("Maintains a compact schedule");
            }
            ranked.add(builder.score(score).build());
        }
        ranked.sort(BY_RANK);
        return ranked;
    }

    private static List<RankedSubstitute> applyAdvice(List<RankedSubstitute> ranked, List<SubstituteRanking> advice) {
        Map<String, RankedSubstitute> remaining = new LinkedHashMap<>();
        ranked.forEach(candidate -> remaining.put(candidate.getFaculty().getId(), candidate));

        List<RankedSubstitute> advised = new ArrayList<>();
        for (SubstituteRanking ranking : advice) {
            RankedSubstitute candidate = remaining.remove(ranking.getFacultyId());
            if (candidate == null) {
                logger.debug("Ignoring advised substitute {}, not a free candidate", ranking.getFacultyId());
                continue;
            }
            RankedSubstitute.RankedSubstituteBuilder builder = candidate.toBuilder()
                    .score(Math.max(0, Math.min(100, ranking.getScore())));
            if (ranking.getReasons() != null && !ranking.getReasons().isEmpty()) {
                builder.clearReasons().reasons(ranking.getReasons());
            }
            advised.add(builder.build());
        }
        advised.sort(Comparator.comparingInt(RankedSubstitute::getScore).reversed());
        advised.addAll(remaining.values());
        logger.info("Advisor re-ranked {} of {} substitutes", advised.size() - remaining.size(), ranked.size());
        return advised;
    }

    private static int workload(TimetableGrid timetable, String facultyId) {
        return (int) timetable.assignments().stream()
                .filter(assignment -> assignment.isTaughtBy(facultyId))
                .count();
    }

    private static int gapsWith(TimetableGrid timetable, String facultyId, ClassAssignment target) {
        List<Integer> slots = timetable.assignments().stream()
                .filter(assignment -> assignment.getDay() == target.getDay() && assignment.isTaughtBy(facultyId))
                .map(ClassAssignment::getSlot)
                .collect(Collectors.toCollection(ArrayList::new));
        slots.add(target.getSlot());
        slots.sort(Comparator.naturalOrder());
        return FitnessEvaluator.idleSlots(slots);
    }
}
