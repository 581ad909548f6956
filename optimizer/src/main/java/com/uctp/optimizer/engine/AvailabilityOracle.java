package com.uctp.optimizer.engine;

import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.Faculty;
import com.uctp.optimizer.model.FacultyAvailabilityConstraint;
import com.uctp.optimizer.model.Room;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;

/**
 * Side-effect free availability checks. Every query reads the grid it is given,
 * so answers always reflect the current placements.
 */
@Component
public class AvailabilityOracle {

    public boolean batchFree(TimetableGrid grid, String batchId, int day, int slot) {
        return grid.get(batchId, day, slot) == null;
    }

    public boolean facultyFree(ProblemSnapshot snapshot, TimetableGrid grid, String facultyId, int day, int slot) {
        return facultyFree(snapshot, grid, facultyId, day, slot, null);
    }

    /**
     * @param excludedAssignmentId session ignored while looking for clashes, usually
     *                             the one whose own placement is being checked
     */
    public boolean facultyFree(ProblemSnapshot snapshot, TimetableGrid grid, String facultyId, int day, int slot,
                               String excludedAssignmentId) {
        Optional<FacultyAvailabilityConstraint> availability = snapshot.availabilityOf(facultyId);
        if (availability.isPresent() && !availability.get().allows(day, slot)) {
            return false;
        }
        if (snapshot.getLeaveCalendar().isOnLeave(facultyId, day)) {
            return false;
        }
        for (ClassAssignment other : grid.assignmentsAt(day, slot)) {
            if (!other.getId().equals(excludedAssignmentId) && other.isTaughtBy(facultyId)) {
                return false;
            }
        }
        return true;
    }

    public boolean roomFree(TimetableGrid grid, Room room, int day, int slot, Batch batch, Subject subject) {
        return roomFree(grid, room, day, slot, batch, subject, null);
    }

    public boolean roomFree(TimetableGrid grid, Room room, int day, int slot, Batch batch, Subject subject,
                            String excludedAssignmentId) {
        if (!isSuitable(room, batch, subject)) {
            return false;
        }
        for (ClassAssignment other : grid.assignmentsAt(day, slot)) {
            if (!other.getId().equals(excludedAssignmentId) && other.getRoomId().equals(room.getId())) {
                return false;
            }
        }
        return true;
    }

    public boolean isSuitable(Room room, Batch batch, Subject subject) {
        return room.getCategory() == subject.requiredRoomCategory()
                && room.getCapacity() >= batch.getStudentCount()
                && batch.allowsRoom(room.getId());
    }

    /** Picks one free, suitable room at random. */
    public Optional<Room> findRoom(ProblemSnapshot snapshot, TimetableGrid grid, Batch batch, Subject subject,
                                   int day, int slot, RandomGenerator rng) {
        List<Room> free = snapshot.getRooms().stream()
                .filter(room -> roomFree(grid, room, day, slot, batch, subject))
                .collect(Collectors.toList());
        if (free.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(free.get(rng.nextInt(free.size())));
    }

    /**
     * Walks the session's faculty candidates in order and keeps the first ones
     * free at (day, slot) until the subject's headcount is reached.
     */
    public Optional<List<String>> selectFaculty(ProblemSnapshot snapshot, TimetableGrid grid, Batch batch,
                                                Subject subject, int day, int slot) {
        int required = subject.requiredFacultyCount();
        List<String> selected = new ArrayList<>(required);
        for (Faculty candidate : snapshot.facultyCandidates(batch.getId(), subject.getId())) {
            if (facultyFree(snapshot, grid, candidate.getId(), day, slot)) {
                selected.add(candidate.getId());
                if (selected.size() >= required) {
                    return Optional.of(selected);
                }
            }
        }
        return Optional.empty();
    }
}
