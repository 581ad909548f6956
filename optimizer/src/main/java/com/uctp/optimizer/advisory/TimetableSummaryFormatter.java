package com.uctp.optimizer.advisory;

import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/** Renders a timetable as one line per session for advisory prompts. */
@Component
public class TimetableSummaryFormatter {

    public String format(ProblemSnapshot snapshot, TimetableGrid grid) {
        return grid.assignments().stream()
                .map(assignment -> line(snapshot, assignment))
                .collect(Collectors.joining("\n"));
    }

    private String line(ProblemSnapshot snapshot, ClassAssignment assignment) {
        return String.format("ID: %s, Class: %s for %s on %s at slot %d",
                assignment.getId(),
                snapshot.subject(assignment.getSubjectId()).getCode(),
                snapshot.batch(assignment.getBatchId()).getName(),
                snapshot.getGeometry().dayName(assignment.getDay()),
                assignment.getSlot());
    }
}
