package com.uctp.optimizer.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Master timetable holding every batch's week. Each batch owns one flat array
 * indexed by {@code day * slotsPerDay + slot}, so a batch can never hold two
 * sessions in the same cell and {@link #copy()} is a plain array copy of
 * immutable {@link ClassAssignment} values.
 */
public class TimetableGrid {
    private final int dayCount;
    private final int slotsPerDay;
    private final Map<String, ClassAssignment[]> cells = new LinkedHashMap<>();

    public TimetableGrid(int dayCount, int slotsPerDay) {
        if (dayCount <= 0 || slotsPerDay <= 0) {
            throw new IllegalArgumentException("Grid needs at least one day and one slot, got "
                    + dayCount + "x" + slotsPerDay);
        }
        this.dayCount = dayCount;
        this.slotsPerDay = slotsPerDay;
    }

    public static TimetableGrid empty(ScheduleGeometry geometry, Collection<String> batchIds) {
        TimetableGrid grid = new TimetableGrid(geometry.dayCount(), geometry.getSlotsPerDay());
        batchIds.forEach(grid::addBatch);
        return grid;
    }

    public TimetableGrid copy() {
        TimetableGrid copy = new TimetableGrid(dayCount, slotsPerDay);
        cells.forEach((batchId, row) -> copy.cells.put(batchId, row.clone()));
        return copy;
    }

    public void addBatch(String batchId) {
        cells.computeIfAbsent(batchId, id -> new ClassAssignment[dayCount * slotsPerDay]);
    }

    public int getDayCount() {
        return dayCount;
    }

    public int getSlotsPerDay() {
        return slotsPerDay;
    }

    public Set<String> batchIds() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    public boolean inBounds(int day, int slot) {
        return day >= 0 && day < dayCount && slot >= 0 && slot < slotsPerDay;
    }

    public ClassAssignment get(String batchId, int day, int slot) {
        ClassAssignment[] row = cells.get(batchId);
        if (row == null || !inBounds(day, slot)) {
            return null;
        }
        return row[index(day, slot)];
    }

    /**
     * Puts the assignment at its own coordinates.
     *
     * @return the assignment previously held by that cell, or {@code null}
     */
    public ClassAssignment place(ClassAssignment assignment) {
        ClassAssignment[] row = rowOf(assignment.getBatchId());
        if (!inBounds(assignment.getDay(), assignment.getSlot())) {
            throw new IllegalArgumentException("Assignment " + assignment.getId() + " is outside the grid: day "
                    + assignment.getDay() + ", slot " + assignment.getSlot());
        }
        int index = index(assignment.getDay(), assignment.getSlot());
        ClassAssignment previous = row[index];
        row[index] = assignment;
        return previous;
    }

    /** Removes the assignment if its cell still holds the same session id. */
    public boolean remove(ClassAssignment assignment) {
        ClassAssignment current = get(assignment.getBatchId(), assignment.getDay(), assignment.getSlot());
        if (current == null || !current.getId().equals(assignment.getId())) {
            return false;
        }
        rowOf(assignment.getBatchId())[index(assignment.getDay(), assignment.getSlot())] = null;
        return true;
    }

    public ClassAssignment clear(String batchId, int day, int slot) {
        ClassAssignment current = get(batchId, day, slot);
        if (current != null) {
            rowOf(batchId)[index(day, slot)] = null;
        }
        return current;
    }

    /** Replaces one batch-day of this grid with the same batch-day of {@code source}. */
    public void copyDayFrom(TimetableGrid source, String batchId, int day) {
        ClassAssignment[] row = rowOf(batchId);
        ClassAssignment[] sourceRow = source.cells.get(batchId);
        for (int slot = 0; slot < slotsPerDay; slot++) {
            row[index(day, slot)] = sourceRow == null || !source.inBounds(day, slot)
                    ? null
                    : sourceRow[source.index(day, slot)];
        }
    }

    /** All assignments in batch, day, slot order. */
    public List<ClassAssignment> assignments() {
        List<ClassAssignment> all = new ArrayList<>();
        for (ClassAssignment[] row : cells.values()) {
            for (ClassAssignment assignment : row) {
                if (assignment != null) {
                    all.add(assignment);
                }
            }
        }
        return all;
    }

    /** Every batch's assignment in one (day, slot) cell. */
    public List<ClassAssignment> assignmentsAt(int day, int slot) {
        if (!inBounds(day, slot)) {
            return Collections.emptyList();
        }
        List<ClassAssignment> found = new ArrayList<>();
        int index = index(day, slot);
        for (ClassAssignment[] row : cells.values()) {
            if (row[index] != null) {
                found.add(row[index]);
            }
        }
        return found;
    }

    /** Occupied slot indices of one batch-day, ascending. */
    public List<Integer> occupiedSlots(String batchId, int day) {
        ClassAssignment[] row = cells.get(batchId);
        if (row == null || day < 0 || day >= dayCount) {
            return Collections.emptyList();
        }
        List<Integer> slots = new ArrayList<>();
        for (int slot = 0; slot < slotsPerDay; slot++) {
            if (row[index(day, slot)] != null) {
                slots.add(slot);
            }
        }
        return slots;
    }

    public Optional<ClassAssignment> findById(String assignmentId) {
        return assignments().stream().filter(a -> a.getId().equals(assignmentId)).findFirst();
    }

    public int size() {
        int size = 0;
        for (ClassAssignment[] row : cells.values()) {
            for (ClassAssignment assignment : row) {
                if (assignment != null) {
                    size++;
                }
            }
        }
        return size;
    }

    /**
     * Canonical text of what is taught where, ignoring session ids. Two grids
     * with equal signatures are the same timetable.
     */
    public String contentSignature() {
        StringBuilder signature = new StringBuilder();
        for (String batchId : new TreeSet<>(cells.keySet())) {
            signature.append(batchId).append('{');
            ClassAssignment[] row = cells.get(batchId);
            for (int i = 0; i < row.length; i++) {
                ClassAssignment a = row[i];
                if (a == null) {
                    continue;
                }
                signature.append(i).append(':').append(a.getSubjectId())
                        .append('/').append(new TreeSet<>(a.getFacultyIds()))
                        .append('@').append(a.getRoomId()).append(';');
            }
            signature.append('}');
        }
        return signature.toString();
    }

    private ClassAssignment[] rowOf(String batchId) {
        ClassAssignment[] row = cells.get(batchId);
        if (row == null) {
            throw new IllegalArgumentException("Batch " + batchId + " has no row in this timetable");
        }
        return row;
    }

    private int index(int day, int slot) {
        return day * slotsPerDay + slot;
    }
}
