package com.uctp.optimizer.snapshot;

import lombok.Value;

/** A (batch, subject) pair; every weekly hour of it is one session. */
@Value(staticConstructor = "of")
public class SessionKey {
    String batchId;
    String subjectId;
}
