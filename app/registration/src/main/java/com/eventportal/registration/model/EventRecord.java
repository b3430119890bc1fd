/*
 * どこで: Registration ドメインモデル
 * 何を: 登録判定に必要なイベント属性 (定員/締切) を表す
 * なぜ: イベント本体の管理は別サービスの責務で、ここでは読み取り専用に扱うため
 */
package com.eventportal.registration.model;

import java.time.Instant;

/**
 * 役割: 登録判定から見たイベントの定員と締切を保持する。 動作: capacity が null なら定員なし、registrationDeadline が null
 * なら締切なしとして扱う。 前提: capacity は 0 以上であること。
 */
public record EventRecord(String eventId, String title, Integer capacity, Instant registrationDeadline) {

  public EventRecord {
    if (capacity != null && capacity < 0) {
      throw new IllegalArgumentException("capacity must be >= 0");
    }
  }

  public boolean isUnbounded() {
    return capacity == null;
  }

  public boolean hasRoomFor(int confirmedCount) {
    return isUnbounded() || confirmedCount < capacity;
  }

  public boolean isRegistrationClosedAt(Instant now) {
    return registrationDeadline != null && now.isAfter(registrationDeadline);
  }
}
