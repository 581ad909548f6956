package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FacultyAllocation {
    String batchId;
    String subjectId;
    @Singular("facultyId")
    List<String> facultyIds;
}
