package com.uctp.optimizer.engine;

import com.uctp.optimizer.config.OptimizerProperties;
import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.Room;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import com.uctp.optimizer.snapshot.SessionKey;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Restores hard feasibility after crossover and mutation. Clashing or surplus
 * sessions are lifted out of the grid, then every missing session gets a
 * bounded number of random placement attempts.
 */
@Component
public class RepairEngine {
    private static final Logger logger = LoggerFactory.getLogger(RepairEngine.class);

    private final AvailabilityOracle oracle;
    private final SessionPlacer sessionPlacer;
    private final OptimizerProperties properties;

    public RepairEngine(AvailabilityOracle oracle, SessionPlacer sessionPlacer, OptimizerProperties properties) {
        this.oracle = oracle;
        this.sessionPlacer = sessionPlacer;
        this.properties = properties;
    }

    @Value
    public static class RepairReport {
        int flagged;
        int placed;
        int unrepaired;
    }

    /** Repairs {@code grid} in place. */
    public RepairReport repair(ProblemSnapshot snapshot, TimetableGrid grid, RandomGenerator rng) {
        snapshot.batchIds().forEach(grid::addBatch);

        // Pins win their cells back; whatever they displace is refilled below.
        Map<SessionKey, Integer> placedCounts = new HashMap<>();
        for (ClassAssignment pinned : snapshot.getPinnedPlacements()) {
            grid.place(pinned);
            placedCounts.merge(keyOf(pinned), 1, Integer::sum);
        }
        List<ClassAssignment> movable = new ArrayList<>();
        for (ClassAssignment assignment : grid.assignments()) {
            if (!snapshot.isPinned(assignment)) {
                movable.add(assignment);
            }
        }

        // Movable sessions are lifted out and re-admitted in scan order, so each is
        // judged against the pins and the sessions already kept.
        movable.forEach(grid::remove);
        Map<SessionKey, Deque<String>> reusableIds = new HashMap<>();
        int flagged = 0;
        for (ClassAssignment assignment : movable) {
            SessionKey key = keyOf(assignment);
            boolean surplus = placedCounts.getOrDefault(key, 0) >= snapshot.requiredSessions(key.getBatchId(), key.getSubjectId());
            if (surplus || hasConflict(snapshot, grid, assignment)) {
                flagged++;
                if (!surplus) {
                    reusableIds.computeIfAbsent(key, k -> new ArrayDeque<>()).add(assignment.getId());
                }
                continue;
            }
            grid.place(assignment);
            placedCounts.merge(key, 1, Integer::sum);
        }

        int placed = 0;
        int unrepaired = 0;
        for (Map.Entry<SessionKey, Integer> required : snapshot.getRequiredSessions().entrySet()) {
            SessionKey key = required.getKey();
            int shortfall = required.getValue() - placedCounts.getOrDefault(key, 0);
            if (shortfall <= 0) {
                continue;
            }
            Batch batch = snapshot.batch(key.getBatchId());
            Subject subject = snapshot.subject(key.getSubjectId());
            Deque<String> ids = reusableIds.getOrDefault(key, new ArrayDeque<>());
            for (int i = 0; i < shortfall; i++) {
                String id = ids.isEmpty() ? AssignmentIds.next(rng) : ids.pollFirst();
                if (sessionPlacer.placeRandomly(snapshot, grid, batch, subject, id, properties.getRepairAttempts(), rng).isPresent()) {
                    placed++;
                } else {
                    unrepaired++;
                }
            }
        }
        if (unrepaired > 0) {
            logger.debug("Repair left {} sessions unplaced ({} flagged, {} placed)", unrepaired, flagged, placed);
        }
        return new RepairReport(flagged, placed, unrepaired);
    }

    /**
     * A session clashes when it is short of faculty, one of its faculty members is busy
     * or unavailable, or its room is taken or unsuitable.
     */
    private boolean hasConflict(ProblemSnapshot snapshot, TimetableGrid grid, ClassAssignment assignment) {
        int day = assignment.getDay();
        int slot = assignment.getSlot();
        Subject subject = snapshot.subject(assignment.getSubjectId());
        if (assignment.getFacultyIds().size() < subject.requiredFacultyCount()) {
            return true;
        }
        for (String facultyId : assignment.getFacultyIds()) {
            if (!oracle.facultyFree(snapshot, grid, facultyId, day, slot, assignment.getId())) {
                return true;
            }
        }
        Room room = snapshot.room(assignment.getRoomId());
        Batch batch = snapshot.batch(assignment.getBatchId());
        return !oracle.roomFree(grid, room, day, slot, batch, subject, assignment.getId());
    }

    private static SessionKey keyOf(ClassAssignment assignment) {
        return SessionKey.of(assignment.getBatchId(), assignment.getSubjectId());
    }
}
