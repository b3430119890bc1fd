/*
 * どこで: Registration API
 * 何を: ユーザの登録一覧のレスポンスを表す
 * なぜ: user_id と registrations を明示的に返すため
 */
package com.eventportal.registration.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserRegistrationsResponse(String userId, List<RegistrationSummary> registrations) {
  public UserRegistrationsResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (registrations != null) {
      registrations = Collections.unmodifiableList(new ArrayList<>(registrations));
    }
  }

  @Override
  public List<RegistrationSummary> registrations() {
    if (registrations == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(registrations));
  }
}
