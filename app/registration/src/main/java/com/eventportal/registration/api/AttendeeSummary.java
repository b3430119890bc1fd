/*
 * どこで: Registration API
 * 何を: イベント参加者一覧の要素を表す
 */
package com.eventportal.registration.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendeeSummary(
    UUID registrationId, String userId, String status, Instant createdAt, Instant cancelledAt) {}
