/*
 * どこで: Registration API
 * 何を: 登録対象イベントの未検出(404)を表す
 * なぜ: イベント管理側に存在しない ID への登録を拒否するため
 */
package com.eventportal.registration.api;

public class EventNotFoundException extends RuntimeException {

  public EventNotFoundException(String eventId) {
    super("event not found: " + eventId);
  }
}
