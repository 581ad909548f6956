package com.uctp.optimizer.engine;

import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.Room;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Builds a fully staffed, roomed session for one (day, slot) if the batch,
 * enough faculty and a suitable room are all free there.
 */
@Component
public class SessionPlacer {
    private final AvailabilityOracle oracle;

    public SessionPlacer(AvailabilityOracle oracle) {
        this.oracle = oracle;
    }

    /** Checks one cell without touching the grid. */
    public Optional<ClassAssignment> tryCell(ProblemSnapshot snapshot, TimetableGrid grid, Batch batch, Subject subject,
                                             String assignmentId, int day, int slot, RandomGenerator rng) {
        if (!oracle.batchFree(grid, batch.getId(), day, slot)) {
            return Optional.empty();
        }
        Optional<List<String>> faculty = oracle.selectFaculty(snapshot, grid, batch, subject, day, slot);
        if (faculty.isEmpty()) {
            return Optional.empty();
        }
        Optional<Room> room = oracle.findRoom(snapshot, grid, batch, subject, day, slot, rng);
        if (room.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ClassAssignment.builder()
                .id(assignmentId)
                .subjectId(subject.getId())
                .facultyIds(faculty.get())
                .roomId(room.get().getId())
                .batchId(batch.getId())
                .day(day)
                .slot(slot)
                .build());
    }

    /**
     * Draws up to {@code attempts} random cells and commits the session to the
     * first one that works.
     *
     * @return the committed session, or empty when every draw failed
     */
    public Optional<ClassAssignment> placeRandomly(ProblemSnapshot snapshot, TimetableGrid grid, Batch batch,
                                                   Subject subject, String assignmentId, int attempts,
                                                   RandomGenerator rng) {
        for (int attempt = 0; attempt < attempts; attempt++) {
            int day = snapshot.getGeometry().randomDay(rng);
            int slot = snapshot.getGeometry().randomSlot(rng);
            Optional<ClassAssignment> placed = tryCell(snapshot, grid, batch, subject, assignmentId, day, slot, rng);
            if (placed.isPresent()) {
                grid.place(placed.get());
                return placed;
            }
        }
        return Optional.empty();
    }
}
