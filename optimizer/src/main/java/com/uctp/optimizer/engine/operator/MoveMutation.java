package com.uctp.optimizer.engine.operator;

import com.uctp.optimizer.config.OptimizerProperties;
import com.uctp.optimizer.engine.AvailabilityOracle;
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
 * Lifts one random session out and drops it into another free cell, keeping
 * its faculty and picking a fresh room.
 */
@Component
public class MoveMutation {
    private final AvailabilityOracle oracle;
    private final OptimizerProperties properties;

    public MoveMutation(AvailabilityOracle oracle, OptimizerProperties properties) {
        this.oracle = oracle;
        this.properties = properties;
    }

    public TimetableGrid mutate(ProblemSnapshot snapshot, TimetableGrid parent, double rate, RandomGenerator rng) {
        TimetableGrid offspring = parent.copy();
        if (rng.nextDouble() > rate) {
            return offspring;
        }
        List<ClassAssignment> assignments = offspring.assignments();
        if (assignments.isEmpty()) {
            return offspring;
        }
        ClassAssignment moving = assignments.get(rng.nextInt(assignments.size()));
        if (snapshot.isPinned(moving)) {
            return offspring;
        }

        offspring.remove(moving);
        Batch batch = snapshot.batch(moving.getBatchId());
        Subject subject = snapshot.subject(moving.getSubjectId());
        for (int attempt = 0; attempt < properties.getMoveAttempts(); attempt++) {
            int day = snapshot.getGeometry().randomDay(rng);
            int slot = snapshot.getGeometry().randomSlot(rng);
            if (!oracle.batchFree(offspring, batch.getId(), day, slot)) {
                continue;
            }
            boolean facultyFree = moving.getFacultyIds().stream()
                    .allMatch(facultyId -> oracle.facultyFree(snapshot, offspring, facultyId, day, slot));
            if (!facultyFree) {
                continue;
            }
            Optional<Room> room = oracle.findRoom(snapshot, offspring, batch, subject, day, slot, rng);
            if (room.isPresent()) {
                offspring.place(moving.moveTo(day, slot).withRoomId(room.get().getId()));
                return offspring;
            }
        }
        offspring.place(moving);
        return offspring;
    }
}
