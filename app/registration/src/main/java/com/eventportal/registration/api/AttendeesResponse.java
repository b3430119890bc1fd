/*
 * どこで: Registration API
 * 何を: イベントの参加者一覧と定員/確定数/待ち数を返す
 * なぜ: 主催者画面で残席とキャンセル待ちの状況を一度に表示するため
 */
package com.eventportal.registration.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendeesResponse(
    String eventId,
    Integer capacity,
    int confirmedCount,
    int waitlistedCount,
    List<AttendeeSummary> attendees) {
  public AttendeesResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (attendees != null) {
      attendees = Collections.unmodifiableList(new ArrayList<>(attendees));
    }
  }

  @Override
  public List<AttendeeSummary> attendees() {
    if (attendees == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(attendees));
  }
}
