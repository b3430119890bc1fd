/*
 * どこで: Registration ドメインモデル
 * 何を: registration_audit の登録用データを表す
 * なぜ: 状態遷移の履歴を後から追跡できるようにするため
 */
package com.eventportal.registration.model;

import java.time.Instant;
import java.util.UUID;

public record RegistrationAuditRecord(
    UUID auditId,
    Instant occurredAt,
    UUID registrationId,
    String eventId,
    String userId,
    String action,
    RegistrationStatus fromStatus,
    RegistrationStatus toStatus,
    String traceId) {}
