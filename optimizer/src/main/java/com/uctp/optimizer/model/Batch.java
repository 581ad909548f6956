package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class Batch {
    String id;
    String name;
    int studentCount;
    @Singular("subjectId")
    List<String> subjectIds;
    // empty means the batch may use any suitable room
    @Singular("allowedRoomId")
    Set<String> allowedRoomIds;

    public boolean allowsRoom(String roomId) {
        return allowedRoomIds.isEmpty() || allowedRoomIds.contains(roomId);
    }
}
