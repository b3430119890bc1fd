/*
 * どこで: Registration API
 * 何を: 同一ユーザの有効な登録が既にある状態(409)を表す
 * なぜ: (event, user) ごとに有効な登録を1件に保つため
 */
package com.eventportal.registration.api;

public class DuplicateRegistrationException extends RuntimeException {

  public DuplicateRegistrationException(String eventId, String userId) {
    super("already registered: event_id=" + eventId + " user_id=" + userId);
  }
}
