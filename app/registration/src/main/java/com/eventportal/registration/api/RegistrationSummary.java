/*
 * どこで: Registration API
 * 何を: ユーザの登録一覧の要素を表す
 */
package com.eventportal.registration.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegistrationSummary(
    UUID registrationId, String eventId, String status, Instant createdAt, Instant cancelledAt) {}
