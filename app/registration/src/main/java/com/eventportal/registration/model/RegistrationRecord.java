/*
 * どこで: Registration ドメインモデル
 * 何を: registrations テーブルのスナップショットを表す
 * なぜ: API 応答と監査ログの生成で共通化するため
 */
package com.eventportal.registration.model;

import java.time.Instant;
import java.util.UUID;

public record RegistrationRecord(
    UUID registrationId,
    long registrationSeq,
    String eventId,
    String userId,
    RegistrationStatus status,
    String ticket,
    Instant createdAt,
    Instant updatedAt,
    Instant cancelledAt) {}
