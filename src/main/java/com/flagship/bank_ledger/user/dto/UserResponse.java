package com.flagship.bank_ledger.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bank_ledger.user.User;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class UserResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("username")
    String username;

    @JsonProperty("created_at")
    Instant createdAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
            .id(user.getId())
            .username(user.getUsername())
            .createdAt(user.getCreatedAt())
            .build();
    }
}
