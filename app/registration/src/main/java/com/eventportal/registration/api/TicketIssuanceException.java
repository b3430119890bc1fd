/*
 * どこで: Registration API
 * 何を: チケット発行の失敗(500)を表す
 * なぜ: チケットのない CONFIRMED を作らず、トランザクションごと中断するため
 */
package com.eventportal.registration.api;

public class TicketIssuanceException extends RuntimeException {

  public TicketIssuanceException(String message, Throwable cause) {
    super(message, cause);
  }
}
