package com.uctp.optimizer.advisory;

import lombok.Value;

/** Two session ids whose time coordinates should be exchanged. */
@Value
public class InterventionSuggestion {
    String firstAssignmentId;
    String secondAssignmentId;
}
