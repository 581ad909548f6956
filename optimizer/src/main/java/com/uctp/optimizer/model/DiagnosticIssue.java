package com.uctp.optimizer.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class DiagnosticIssue {
    public enum Severity { CRITICAL, WARNING }

    Severity severity;
    String title;
    String description;
    String suggestion;
}
