package com.uctp.optimizer.snapshot;

import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.ConstraintWeights;
import com.uctp.optimizer.model.Faculty;
import com.uctp.optimizer.model.FacultyAllocation;
import com.uctp.optimizer.model.FacultyAvailabilityConstraint;
import com.uctp.optimizer.model.FeedbackSample;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.model.PinnedAssignment;
import com.uctp.optimizer.model.PlannedLeave;
import com.uctp.optimizer.model.Room;
import com.uctp.optimizer.model.ScheduleGeometry;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.model.TimetableGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Validated, indexed, read-only view of an {@link OptimizationRequest}. Built
 * once per run and shared by every worker without locking.
 */
public final class ProblemSnapshot {
    private static final Logger logger = LoggerFactory.getLogger(ProblemSnapshot.class);

    private final List<Batch> batches;
    private final Map<String, Batch> batchesById;
    private final Map<String, Subject> subjectsById;
    private final List<Faculty> faculty;
    private final Map<String, Faculty> facultyById;
    private final List<Room> rooms;
    private final Map<String, Room> roomsById;
    private final Map<String, FacultyAvailabilityConstraint> availabilityByFaculty;
    private final Map<SessionKey, List<Faculty>> facultyCandidates;
    private final Map<SessionKey, Integer> requiredSessions;
    private final List<ClassAssignment> pinnedPlacements;
    private final Set<String> pinnedCells;
    private final int pinnedAssignmentCount;
    private final LeaveCalendar leaveCalendar;
    private final ScheduleGeometry geometry;
    private final ConstraintWeights weights;
    private final TimetableGrid baseline;
    private final int candidateCount;
    private final List<FeedbackSample> feedbackSamples;

    private ProblemSnapshot(OptimizationRequest request, ConstraintWeights weights) {
        this.geometry = request.getGeometry();
        this.weights = weights;
        this.candidateCount = request.getCandidateCount();
        this.batches = List.copyOf(request.getBatches());
        this.batchesById = index(request.getBatches(), Batch::getId, "batch");
        this.subjectsById = index(request.getSubjects(), Subject::getId, "subject");
        this.faculty = List.copyOf(request.getFaculty());
        this.facultyById = index(request.getFaculty(), Faculty::getId, "faculty");
        this.rooms = List.copyOf(request.getRooms());
        this.roomsById = index(request.getRooms(), Room::getId, "room");
        this.availabilityByFaculty = request.getAvailabilityConstraints().stream()
                .collect(Collectors.toMap(FacultyAvailabilityConstraint::getFacultyId, Function.identity(),
                        (first, second) -> first, LinkedHashMap::new));
        this.requiredSessions = buildRequiredSessions();
        this.facultyCandidates = buildFacultyCandidates(request.getFacultyAllocations());
        this.pinnedAssignmentCount = request.getPinnedAssignments().size();
        this.pinnedPlacements = expandPins(request.getPinnedAssignments());
        this.pinnedCells = pinnedPlacements.stream()
                .map(p -> cellKey(p.getBatchId(), p.getDay(), p.getSlot()))
                .collect(Collectors.toUnmodifiableSet());
        this.leaveCalendar = request.getPlannedLeaves().isEmpty() || request.getWeekStart() == null
                ? LeaveCalendar.NONE
                : new WeekLeaveCalendar(request.getWeekStart(), request.getPlannedLeaves());
        this.baseline = request.getBaseline();
        this.feedbackSamples = List.copyOf(request.getFeedbackSamples());
    }

    private ProblemSnapshot(ProblemSnapshot source, ConstraintWeights weights) {
        this.batches = source.batches;
        this.batchesById = source.batchesById;
        this.subjectsById = source.subjectsById;
        this.faculty = source.faculty;
        this.facultyById = source.facultyById;
        this.rooms = source.rooms;
        this.roomsById = source.roomsById;
        this.availabilityByFaculty = source.availabilityByFaculty;
        this.facultyCandidates = source.facultyCandidates;
        this.requiredSessions = source.requiredSessions;
        this.pinnedPlacements = source.pinnedPlacements;
        this.pinnedCells = source.pinnedCells;
        this.pinnedAssignmentCount = source.pinnedAssignmentCount;
        this.leaveCalendar = source.leaveCalendar;
        this.geometry = source.geometry;
        this.baseline = source.baseline;
        this.candidateCount = source.candidateCount;
        this.feedbackSamples = source.feedbackSamples;
        this.weights = weights;
    }

    /**
     * Validates every reference inside the request and indexes it.
     *
     * @throws InvalidProblemException on the first unknown or malformed reference
     */
    public static ProblemSnapshot from(OptimizationRequest request) {
        new RequestValidator(request).validate();
        return new ProblemSnapshot(request, request.getWeights());
    }

    public ProblemSnapshot withWeights(ConstraintWeights tunedWeights) {
        return new ProblemSnapshot(this, tunedWeights);
    }

    public List<Batch> getBatches() {
        return batches;
    }

    public List<String> batchIds() {
        return batches.stream().map(Batch::getId).collect(Collectors.toList());
    }

    public Batch batch(String batchId) {
        return lookup(batchesById, batchId, "batch");
    }

    public Subject subject(String subjectId) {
        return lookup(subjectsById, subjectId, "subject");
    }

    public Collection<Subject> getSubjects() {
        return Collections.unmodifiableCollection(subjectsById.values());
    }

    public List<Faculty> getFaculty() {
        return faculty;
    }

    public Faculty faculty(String facultyId) {
        return lookup(facultyById, facultyId, "faculty");
    }

    public List<Room> getRooms() {
        return rooms;
    }

    public Room room(String roomId) {
        return lookup(roomsById, roomId, "room");
    }

    public Optional<FacultyAvailabilityConstraint> availabilityOf(String facultyId) {
        return Optional.ofNullable(availabilityByFaculty.get(facultyId));
    }

    public int availabilityConstraintCount() {
        return availabilityByFaculty.size();
    }

    /**
     * Faculty who may teach a session: the batch-specific allocation when one
     * exists, otherwise everybody qualified for the subject.
     */
    public List<Faculty> facultyCandidates(String batchId, String subjectId) {
        return facultyCandidates.getOrDefault(SessionKey.of(batchId, subjectId), Collections.emptyList());
    }

    /** Required weekly sessions per (batch, subject), in batch order. */
    public Map<SessionKey, Integer> getRequiredSessions() {
        return requiredSessions;
    }

    public int requiredSessions(String batchId, String subjectId) {
        return requiredSessions.getOrDefault(SessionKey.of(batchId, subjectId), 0);
    }

    public int totalRequiredSessions() {
        return requiredSessions.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Concrete placements of every pinned assignment, ids stable across individuals. */
    public List<ClassAssignment> getPinnedPlacements() {
        return pinnedPlacements;
    }

    public int pinnedAssignmentCount() {
        return pinnedAssignmentCount;
    }

    public boolean isPinned(String batchId, int day, int slot) {
        return pinnedCells.contains(cellKey(batchId, day, slot));
    }

    public boolean isPinned(ClassAssignment assignment) {
        return isPinned(assignment.getBatchId(), assignment.getDay(), assignment.getSlot());
    }

    public LeaveCalendar getLeaveCalendar() {
        return leaveCalendar;
    }

    public ScheduleGeometry getGeometry() {
        return geometry;
    }

    public ConstraintWeights getWeights() {
        return weights;
    }

    public Optional<TimetableGrid> getBaseline() {
        return Optional.ofNullable(baseline);
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public List<FeedbackSample> getFeedbackSamples() {
        return feedbackSamples;
    }

    private Map<SessionKey, Integer> buildRequiredSessions() {
        Map<SessionKey, Integer> required = new LinkedHashMap<>();
        for (Batch batch : batches) {
            for (String subjectId : new LinkedHashSet<>(batch.getSubjectIds())) {
                required.put(SessionKey.of(batch.getId(), subjectId), subjectsById.get(subjectId).getHoursPerWeek());
            }
        }
        return Collections.unmodifiableMap(required);
    }

    private Map<SessionKey, List<Faculty>> buildFacultyCandidates(List<FacultyAllocation> allocations) {
        Map<SessionKey, Set<String>> allocated = new LinkedHashMap<>();
        for (FacultyAllocation allocation : allocations) {
            if (!allocation.getFacultyIds().isEmpty()) {
                allocated.putIfAbsent(SessionKey.of(allocation.getBatchId(), allocation.getSubjectId()),
                        new HashSet<>(allocation.getFacultyIds()));
            }
        }
        Map<SessionKey, List<Faculty>> candidates = new LinkedHashMap<>();
        for (SessionKey key : requiredSessions.keySet()) {
            Set<String> specific = allocated.get(key);
            List<Faculty> eligible = faculty.stream()
                    .filter(f -> specific != null ? specific.contains(f.getId()) : f.isQualifiedFor(key.getSubjectId()))
                    .collect(Collectors.toUnmodifiableList());
            candidates.put(key, eligible);
        }
        return Collections.unmodifiableMap(candidates);
    }

    private List<ClassAssignment> expandPins(List<PinnedAssignment> pins) {
        List<ClassAssignment> placements = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        int dayCount = geometry.dayCount();
        for (PinnedAssignment pin : pins) {
            for (int day : pin.getDays()) {
                for (int startSlot : pin.getStartSlots()) {
                    for (int offset = 0; offset < pin.getDuration(); offset++) {
                        int slot = startSlot + offset;
                        if (day < 0 || day >= dayCount || !geometry.containsSlot(slot)) {
                            logger.warn("Pinned assignment {} skips day {} slot {}: outside the {}x{} week",
                                    pin.getId(), day, slot, dayCount, geometry.getSlotsPerDay());
                            continue;
                        }
                        if (!taken.add(cellKey(pin.getBatchId(), day, slot))) {
                            logger.warn("Pinned assignment {} overlaps an earlier pin of batch {} on day {} slot {}; keeping the earlier one",
                                    pin.getId(), pin.getBatchId(), day, slot);
                            continue;
                        }
                        placements.add(ClassAssignment.builder()
                                .id("pin_" + pin.getId() + "_" + day + "_" + slot)
                                .subjectId(pin.getSubjectId())
                                .facultyId(pin.getFacultyId())
                                .roomId(pin.getRoomId())
                                .batchId(pin.getBatchId())
                                .day(day)
                                .slot(slot)
                                .build());
                    }
                }
            }
        }
        return Collections.unmodifiableList(placements);
    }

    private static String cellKey(String batchId, int day, int slot) {
        return batchId + "|" + day + "|" + slot;
    }

    private static <T> Map<String, T> index(List<T> items, Function<T, String> idOf, String kind) {
        Map<String, T> indexed = new LinkedHashMap<>();
        for (T item : items) {
            String id = idOf.apply(item);
            if (id == null || id.isBlank()) {
                throw new InvalidProblemException("A " + kind + " has no id");
            }
            if (indexed.put(id, item) != null) {
                throw new InvalidProblemException("Duplicate " + kind + " id '" + id + "'");
            }
        }
        return Collections.unmodifiableMap(indexed);
    }

    private static <T> T lookup(Map<String, T> index, String id, String kind) {
        T found = index.get(id);
        if (found == null) {
            throw new InvalidProblemException("Unknown " + kind + " id '" + id + "'");
        }
        return found;
    }

    /** Fail-fast reference checks run before anything is indexed. */
    private static final class RequestValidator {
        private final OptimizationRequest request;
        private final Set<String> batchIds;
        private final Set<String> subjectIds;
        private final Set<String> facultyIds;
        private final Set<String> roomIds;

        RequestValidator(OptimizationRequest request) {
            this.request = request;
            this.batchIds = ids(request.getBatches().stream().map(Batch::getId));
            this.subjectIds = ids(request.getSubjects().stream().map(Subject::getId));
            this.facultyIds = ids(request.getFaculty().stream().map(Faculty::getId));
            this.roomIds = ids(request.getRooms().stream().map(Room::getId));
        }

        void validate() {
            validateGeometry();
            if (request.getCandidateCount() < 1) {
                throw new InvalidProblemException("Candidate count must be at least 1, got " + request.getCandidateCount());
            }
            if (request.getWeights() == null || !request.getWeights().isValid()) {
                throw new InvalidProblemException("Constraint weights must be finite and non-negative: " + request.getWeights());
            }
            for (Subject subject : request.getSubjects()) {
                if (subject.getHoursPerWeek() < 0) {
                    throw new InvalidProblemException("Subject '" + subject.getId() + "' has negative hours per week");
                }
            }
            for (Batch batch : request.getBatches()) {
                batch.getSubjectIds().forEach(id -> require(subjectIds, id, "subject", "batch '" + batch.getId() + "'"));
                batch.getAllowedRoomIds().forEach(id -> require(roomIds, id, "room", "batch '" + batch.getId() + "'"));
            }
            for (Faculty member : request.getFaculty()) {
                member.getSubjectIds().forEach(id -> require(subjectIds, id, "subject", "faculty '" + member.getId() + "'"));
            }
            for (PinnedAssignment pin : request.getPinnedAssignments()) {
                String owner = "pinned assignment '" + pin.getId() + "'";
                require(batchIds, pin.getBatchId(), "batch", owner);
                require(subjectIds, pin.getSubjectId(), "subject", owner);
                require(facultyIds, pin.getFacultyId(), "faculty", owner);
                require(roomIds, pin.getRoomId(), "room", owner);
                if (pin.getDuration() < 1) {
                    throw new InvalidProblemException(owner + " has a duration below one slot");
                }
            }
            for (FacultyAvailabilityConstraint constraint : request.getAvailabilityConstraints()) {
                require(facultyIds, constraint.getFacultyId(), "faculty", "availability constraint");
            }
            for (FacultyAllocation allocation : request.getFacultyAllocations()) {
                String owner = "faculty allocation for batch '" + allocation.getBatchId() + "'";
                require(batchIds, allocation.getBatchId(), "batch", owner);
                require(subjectIds, allocation.getSubjectId(), "subject", owner);
                allocation.getFacultyIds().forEach(id -> require(facultyIds, id, "faculty", owner));
            }
            for (PlannedLeave leave : request.getPlannedLeaves()) {
                String owner = "planned leave '" + leave.getId() + "'";
                require(facultyIds, leave.getFacultyId(), "faculty", owner);
                if (leave.getStartDate() == null || leave.getEndDate() == null) {
                    throw new InvalidProblemException(owner + " needs both a start and an end date");
                }
                if (leave.getStartDate().isAfter(leave.getEndDate())) {
                    throw new InvalidProblemException(owner + " ends on " + leave.getEndDate()
                            + " before it starts on " + leave.getStartDate());
                }
            }
            for (FeedbackSample sample : request.getFeedbackSamples()) {
                require(facultyIds, sample.getFacultyId(), "faculty", "feedback sample");
                if (sample.getRating() < FeedbackSample.MIN_RATING || sample.getRating() > FeedbackSample.MAX_RATING) {
                    throw new InvalidProblemException("Feedback for faculty '" + sample.getFacultyId()
                            + "' has rating " + sample.getRating() + ", expected " + FeedbackSample.MIN_RATING
                            + ".." + FeedbackSample.MAX_RATING);
                }
            }
            if (request.getBaseline() != null) {
                validateBaseline(request.getBaseline());
            }
        }

        private void validateGeometry() {
            ScheduleGeometry geometry = request.getGeometry();
            if (geometry == null) {
                throw new InvalidProblemException("Schedule geometry is required");
            }
            if (geometry.getWorkingDays().isEmpty() || geometry.getSlotsPerDay() < 1) {
                throw new InvalidProblemException("Schedule geometry needs at least one working day and one slot");
            }
            if (geometry.getWorkingDays().stream().anyMatch(day -> day < 0)) {
                throw new InvalidProblemException("Working day indices must not be negative: " + geometry.getWorkingDays());
            }
        }

        private void validateBaseline(TimetableGrid baseline) {
            ScheduleGeometry geometry = request.getGeometry();
            if (baseline.getDayCount() != geometry.dayCount() || baseline.getSlotsPerDay() != geometry.getSlotsPerDay()) {
                throw new InvalidProblemException("Baseline timetable is " + baseline.getDayCount() + "x"
                        + baseline.getSlotsPerDay() + " but the week is " + geometry.dayCount() + "x"
                        + geometry.getSlotsPerDay());
            }
            baseline.batchIds().forEach(id -> require(batchIds, id, "batch", "baseline timetable"));
            for (ClassAssignment assignment : baseline.assignments()) {
                String owner = "baseline assignment '" + assignment.getId() + "'";
                require(subjectIds, assignment.getSubjectId(), "subject", owner);
                require(roomIds, assignment.getRoomId(), "room", owner);
                assignment.getFacultyIds().forEach(id -> require(facultyIds, id, "faculty", owner));
            }
        }

        private static void require(Set<String> known, String id, String kind, String owner) {
            if (!known.contains(id)) {
                throw new InvalidProblemException(owner + " refers to unknown " + kind + " id '" + id + "'");
            }
        }

        private static Set<String> ids(Stream<String> ids) {
            return ids.collect(Collectors.toSet());
        }
    }
}
