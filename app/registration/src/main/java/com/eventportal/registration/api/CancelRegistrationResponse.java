/*
 * どこで: Registration API
 * 何を: 取消結果と、それに伴って昇格した登録 ID を返す
 */
package com.eventportal.registration.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CancelRegistrationResponse(
    UUID registrationId,
    String eventId,
    String userId,
    String previousStatus,
    Instant cancelledAt,
    UUID promotedRegistrationId) {}
