package com.example.spontaneous.shared.mapper;

import com.example.spontaneous.shared.dto.BroadcastResponse;
import com.example.spontaneous.shared.dto.JoinRequestResponse;
import com.example.spontaneous.shared.model.Broadcast;
import com.example.spontaneous.shared.model.JoinRequest;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper(componentModel = "spring")
public abstract class BroadcastMapper {

    /**
     * Listing view: no join requests, status derived from the deadline at {@code now}.
     */
    @Mapping(target = "status", expression = "java(broadcast.effectiveStatus(now))")
    @Mapping(target = "joinRequests", ignore = true)
    public abstract BroadcastResponse toBroadcastResponse(Broadcast broadcast, @Context OffsetDateTime now);

    public abstract JoinRequestResponse toJoinRequestResponse(JoinRequest joinRequest);

    public abstract List<JoinRequestResponse> toJoinRequestResponses(List<JoinRequest> joinRequests);

    public BroadcastResponse toDetailedBroadcastResponse(Broadcast broadcast, List<JoinRequest> joinRequests, OffsetDateTime now) {
        BroadcastResponse response = toBroadcastResponse(broadcast, now);
        response.setJoinRequests(toJoinRequestResponses(joinRequests));
        return response;
    }
}
