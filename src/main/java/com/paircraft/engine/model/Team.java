package com.paircraft.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A team in a team-swiss event. Member order is board order.
 */
public record Team(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("section") String section,
    @JsonProperty("memberIds") List<String> memberIds
) {
    public Team {
        name = name == null ? id : name;
        section = section == null || section.isBlank() ? Player.DEFAULT_SECTION : section;
        memberIds = memberIds == null ? ImmutableList.of() : ImmutableList.copyOf(memberIds);
    }
}
