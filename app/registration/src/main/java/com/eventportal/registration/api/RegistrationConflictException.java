/*
 * どこで: Registration API
 * 何を: 再試行しても解消しなかった同時更新の競合(409)を表す
 * なぜ: 呼び出し側に再送可能なエラーとして伝えるため
 */
package com.eventportal.registration.api;

public class RegistrationConflictException extends RuntimeException {

  public RegistrationConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
