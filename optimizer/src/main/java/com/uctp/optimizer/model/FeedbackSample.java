package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FeedbackSample {
    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    String facultyId;
    int rating;
    String comment;
}
