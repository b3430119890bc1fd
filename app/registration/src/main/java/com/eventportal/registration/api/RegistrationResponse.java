/*
 * どこで: Registration API
 * 何を: 登録結果 (確定チケットまたはキャンセル待ち順位) のレスポンスを表す
 * なぜ: CONFIRMED と WAITLISTED を同じ形で返し、クライアント側の分岐を単純にするため
 */
package com.eventportal.registration.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

/**
 * 役割: 登録結果を返す。 動作: ticket は CONFIRMED のときだけ、waitlistPosition (1 始まり) は WAITLISTED のときだけ設定する。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegistrationResponse(
    UUID registrationId,
    String eventId,
    String userId,
    String status,
    String ticket,
    Integer waitlistPosition,
    Instant createdAt) {}
