/*
 * どこで: Registration サービス層
 * 何を: CONFIRMED になった登録へ入場チケットを発行する
 * なぜ: チケット形式を登録ワークフローから差し替え可能にするため
 */
package com.eventportal.registration.service;

import java.util.UUID;

public interface TicketIssuer {

  /**
   * 役割: CONFIRMED になる登録へチケット文字列を発行する。 動作: 発行できない場合は TicketIssuanceException を投げる。 前提:
   * registrationId は挿入前に採番済みであること。
   */
  String issue(UUID registrationId, String eventId, String userId);
}
