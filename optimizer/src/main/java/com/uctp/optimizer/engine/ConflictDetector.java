package com.uctp.optimizer.engine;

import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds faculty and room double-bookings across batches. A batch cannot be
 * double-booked because the grid holds one session per batch cell.
 */
@Component
public class ConflictDetector {

    /** Session id to the conflicts it takes part in. */
    public Map<String, List<Conflict>> detect(ProblemSnapshot snapshot, TimetableGrid grid) {
        Map<String, List<Conflict>> conflicts = new LinkedHashMap<>();
        for (int day = 0; day < grid.getDayCount(); day++) {
            for (int slot = 0; slot < grid.getSlotsPerDay(); slot++) {
                List<ClassAssignment> cell = grid.assignmentsAt(day, slot);
                if (cell.size() < 2) {
                    continue;
                }
                Map<String, List<String>> byFaculty = new LinkedHashMap<>();
                Map<String, List<String>> byRoom = new LinkedHashMap<>();
                for (ClassAssignment assignment : cell) {
                    assignment.getFacultyIds().forEach(facultyId ->
                            byFaculty.computeIfAbsent(facultyId, k -> new ArrayList<>()).add(assignment.getId()));
                    byRoom.computeIfAbsent(assignment.getRoomId(), k -> new ArrayList<>()).add(assignment.getId());
                }
                byFaculty.forEach((facultyId, ids) -> {
                    if (ids.size() > 1) {
                        Conflict conflict = new Conflict(Conflict.Type.FACULTY,
                                "Faculty Conflict: " + snapshot.faculty(facultyId).getName() + " is double-booked.");
                        ids.forEach(id -> conflicts.computeIfAbsent(id, k -> new ArrayList<>()).add(conflict));
                    }
                });
                byRoom.forEach((roomId, ids) -> {
                    if (ids.size() > 1) {
                        Conflict conflict = new Conflict(Conflict.Type.ROOM,
                                "Room Conflict: " + snapshot.room(roomId).getName() + " is double-booked.");
                        ids.forEach(id -> conflicts.computeIfAbsent(id, k -> new ArrayList<>()).add(conflict));
                    }
                });
            }
        }
        return conflicts;
    }

    public int countConflictingAssignments(ProblemSnapshot snapshot, TimetableGrid grid) {
        return detect(snapshot, grid).size();
    }
}
