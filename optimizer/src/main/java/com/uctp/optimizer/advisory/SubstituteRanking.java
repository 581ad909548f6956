package com.uctp.optimizer.advisory;

import lombok.Value;

import java.util.List;

@Value
public class SubstituteRanking {
    String facultyId;
    int score;
    List<String> reasons;
}
