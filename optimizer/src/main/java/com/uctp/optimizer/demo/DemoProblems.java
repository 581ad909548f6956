package com.uctp.optimizer.demo;

import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.BreakPeriod;
import com.uctp.optimizer.model.DaySettings;
import com.uctp.optimizer.model.Faculty;
import com.uctp.optimizer.model.FacultyAllocation;
import com.uctp.optimizer.model.FacultyAvailabilityConstraint;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.model.PinnedAssignment;
import com.uctp.optimizer.model.Room;
import com.uctp.optimizer.model.RoomCategory;
import com.uctp.optimizer.model.ScheduleGeometry;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.model.SubjectCategory;

import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/** Small ready-made problems for the demo runner. */
public final class DemoProblems {
    private DemoProblems() {
    }

    /** Two batches of one department, five days of six periods, one pinned lecture. */
    public static OptimizationRequest smallDepartment() {
        return OptimizationRequest.builder()
                .geometry(ScheduleGeometry.of(List.of(0, 1, 2, 3, 4), DaySettings.builder()
                        .collegeStartTime(LocalTime.of(9, 0))
                        .collegeEndTime(LocalTime.of(16, 0))
                        .periodMinutes(60)
                        .breakPeriod(new BreakPeriod("Lunch", LocalTime.of(12, 0), LocalTime.of(13, 0)))
                        .build()))
                .subject(Subject.builder().id("CS101").name("Programming Fundamentals").code("CS101").hoursPerWeek(4).build())
                .subject(Subject.builder().id("MA101").name("Discrete Mathematics").code("MA101").hoursPerWeek(3).build())
                .subject(Subject.builder().id("PH101").name("Engineering Physics").code("PH101").hoursPerWeek(3).build())
                .subject(Subject.builder().id("CS101L").name("Programming Lab").code("CS101L").hoursPerWeek(2)
                        .category(SubjectCategory.PRACTICAL).build())
                .subject(Subject.builder().id("ME101W").name("Workshop Practice").code("ME101W").hoursPerWeek(2)
                        .category(SubjectCategory.WORKSHOP).build())
                .facultyMember(Faculty.builder().id("F1").name("Dr. Rao").subjectId("CS101").subjectId("CS101L")
                        .preferredDay(0, Set.of(0, 1, 2)).preferredDay(2, Set.of(0, 1, 2)).build())
                .facultyMember(Faculty.builder().id("F2").name("Dr. Mehta").subjectId("MA101").build())
                .facultyMember(Faculty.builder().id("F3").name("Dr. Iyer").subjectId("PH101").subjectId("MA101").build())
                .facultyMember(Faculty.builder().id("F4").name("Ms. Kapoor").subjectId("CS101L").subjectId("CS101").build())
                .facultyMember(Faculty.builder().id("F5").name("Mr. Singh").subjectId("ME101W").build())
                .room(Room.builder().id("R101").name("Room 101").capacity(60).build())
                .room(Room.builder().id("R102").name("Room 102").capacity(60).build())
                .room(Room.builder().id("LAB1").name("Computer Lab 1").capacity(60).category(RoomCategory.LAB).build())
                .room(Room.builder().id("WS1").name("Central Workshop").capacity(80).category(RoomCategory.WORKSHOP).build())
                .batch(Batch.builder().id("CSE-A").name("CSE Section A").studentCount(55)
                        .subjectId("CS101").subjectId("MA101").subjectId("PH101").subjectId("CS101L").subjectId("ME101W")
                        .build())
                .batch(Batch.builder().id("CSE-B").name("CSE Section B").studentCount(50)
                        .subjectId("CS101").subjectId("MA101").subjectId("PH101").subjectId("CS101L").subjectId("ME101W")
                        .build())
                .facultyAllocation(FacultyAllocation.builder().batchId("CSE-B").subjectId("MA101").facultyId("F3").build())
                .availabilityConstraint(FacultyAvailabilityConstraint.builder().facultyId("F5")
                        .allowedDay(1, Set.of(0, 1, 2, 3, 4, 5)).allowedDay(3, Set.of(0, 1, 2, 3, 4, 5)).build())
                .pinnedAssignment(PinnedAssignment.builder().id("assembly").name("Monday physics lecture")
                        .subjectId("PH101").facultyId("F3").roomId("R101").batchId("CSE-A")
                        .day(0).startSlot(0).build())
                .candidateCount(3)
                .build();
    }
}
