package com.uctp.optimizer.engine;

import lombok.Value;

@Value
public class Conflict {
    public enum Type { FACULTY, ROOM }

    Type type;
    String message;
}
