/*
 * どこで: Registration API
 * 何を: 有効な参加登録の未検出(404)を表す
 * なぜ: 取消/参照の対象がない場合を明確に扱うため
 */
package com.eventportal.registration.api;

public class RegistrationNotFoundException extends RuntimeException {

  public RegistrationNotFoundException(String eventId, String userId) {
    super("active registration not found: event_id=" + eventId + " user_id=" + userId);
  }
}
