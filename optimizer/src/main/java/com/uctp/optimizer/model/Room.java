package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Room {
    String id;
    String name;
    int capacity;
    @Builder.Default
    RoomCategory category = RoomCategory.LECTURE_HALL;
}
