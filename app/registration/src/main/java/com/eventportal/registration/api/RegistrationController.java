/*
 * どこで: Registration API
 * 何を: 参加登録/取消/参照のエンドポイントを提供する
 * なぜ: 登録ワークフローの公開インターフェースを明確にするため
 */
package com.eventportal.registration.api;

import com.eventportal.registration.service.RegistrationService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class RegistrationController {

  // 認証は前段のゲートウェイで済んでいる前提で、利用者 ID はヘッダで受け取る
  private static final String HEADER_USER_ID = "X-User-Id";
  private static final String HEADER_TRACE_ID = "X-Trace-Id";

  private final RegistrationService registrationService;

  @PostMapping("/events/{event_id}/registrations")
  public ResponseEntity<RegistrationResponse> register(
      @PathVariable("event_id") @NotBlank(message = "event_id is required") String eventId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId) {
    final RegistrationResponse response = registrationService.register(eventId, userId, traceId);
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @DeleteMapping("/events/{event_id}/registrations")
  public CancelRegistrationResponse cancel(
      @PathVariable("event_id") @NotBlank(message = "event_id is required") String eventId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId) {
    return registrationService.cancel(eventId, userId, traceId);
  }

  @GetMapping("/events/{event_id}/registrations/{user_id}")
  public RegistrationResponse find(
      @PathVariable("event_id") @NotBlank(message = "event_id is required") String eventId,
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
    return registrationService.findRegistration(eventId, userId);
  }

  @GetMapping("/events/{event_id}/attendees")
  public AttendeesResponse attendees(
      @PathVariable("event_id") @NotBlank(message = "event_id is required") String eventId) {
    return registrationService.listAttendees(eventId);
  }

  @GetMapping("/users/{user_id}/registrations")
  public UserRegistrationsResponse listByUser(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
    return registrationService.listByUser(userId);
  }
}
