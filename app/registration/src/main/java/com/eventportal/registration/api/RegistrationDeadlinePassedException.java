/*
 * どこで: Registration API
 * 何を: 登録締切後の登録要求(400)を表す
 */
package com.eventportal.registration.api;

import java.time.Instant;

public class RegistrationDeadlinePassedException extends RuntimeException {

  public RegistrationDeadlinePassedException(String eventId, Instant deadline) {
    super("registration deadline has passed: event_id=" + eventId + " deadline=" + deadline);
  }
}
