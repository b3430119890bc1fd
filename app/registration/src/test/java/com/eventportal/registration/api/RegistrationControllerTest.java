/*
 * どこで: Registration API のWeb層テスト
 * 何を: エンドポイントの応答形式と例外からエラーコードへの変換を検証する
 * なぜ: クライアントが code で拒否理由を判別できることを保証するため
 */
package com.eventportal.registration.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.eventportal.registration.service.RegistrationService;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RegistrationController.class)
@Import(ApiExceptionHandler.class)
class RegistrationControllerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-03-01T09:00:00Z");
  private static final UUID REGISTRATION_ID =
      UUID.fromString("7b0a3f0e-4a57-4c1c-9a59-2d1d7f0c2a11");
  private static final UUID PROMOTED_ID = UUID.fromString("0f9b52a4-35a1-4d4e-8f0c-7c3f5b0e6d22");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private RegistrationService registrationService;

  @Test
  void registerReturnsCreatedWithTicket() throws Exception {
    when(registrationService.register("event-1", "user-1", "trace-1"))
        .thenReturn(
            new RegistrationResponse(
                REGISTRATION_ID, "event-1", "user-1", "CONFIRMED", "ticket-1", null, CREATED_AT));

    mockMvc
        .perform(
            post("/v1/events/event-1/registrations")
                .header("X-User-Id", "user-1")
                .header("X-Trace-Id", "trace-1"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.registration_id").value(REGISTRATION_ID.toString()))
        .andExpect(jsonPath("$.status").value("CONFIRMED"))
        .andExpect(jsonPath("$.ticket").value("ticket-1"))
        .andExpect(jsonPath("$.created_at").value("2026-03-01T09:00:00Z"));
  }

  @Test
  void registerReturnsWaitlistPosition() throws Exception {
    when(registrationService.register(eq("event-1"), eq("user-2"), isNull()))
        .thenReturn(
            new RegistrationResponse(
                REGISTRATION_ID, "event-1", "user-2", "WAITLISTED", null, 3, CREATED_AT));

    mockMvc
        .perform(post("/v1/events/event-1/registrations").header("X-User-Id", "user-2"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.status").value("WAITLISTED"))
        .andExpect(jsonPath("$.waitlist_position").value(3));
  }

  @Test
  void registerReturnsBadRequestWhenUserHeaderMissing() throws Exception {
    mockMvc
        .perform(post("/v1/events/event-1/registrations"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("X-User-Id is required"));

    verifyNoInteractions(registrationService);
  }

  @Test
  void registerReturnsBadRequestWhenUserHeaderBlank() throws Exception {
    mockMvc
        .perform(post("/v1/events/event-1/registrations").header("X-User-Id", " "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void registerMapsRejectionsToErrorCodes() throws Exception {
    when(registrationService.register(eq("missing"), eq("user-1"), any()))
        .thenThrow(new EventNotFoundException("missing"));
    when(registrationService.register(eq("closed"), eq("user-1"), any()))
        .thenThrow(new RegistrationDeadlinePassedException("closed", CREATED_AT));
    when(registrationService.register(eq("dup"), eq("user-1"), any()))
        .thenThrow(new DuplicateRegistrationException("dup", "user-1"));
    when(registrationService.register(eq("busy"), eq("user-1"), any()))
        .thenThrow(new RegistrationConflictException("concurrent update conflict", null));
    when(registrationService.register(eq("broken"), eq("user-1"), any()))
        .thenThrow(new TicketIssuanceException("signer down", null));

    mockMvc
        .perform(post("/v1/events/missing/registrations").header("X-User-Id", "user-1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("EVENT_NOT_FOUND"));
    mockMvc
        .perform(post("/v1/events/closed/registrations").header("X-User-Id", "user-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("REGISTRATION_DEADLINE_PASSED"));
    mockMvc
        .perform(post("/v1/events/dup/registrations").header("X-User-Id", "user-1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("DUPLICATE_REGISTRATION"));
    mockMvc
        .perform(post("/v1/events/busy/registrations").header("X-User-Id", "user-1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONCURRENCY_CONFLICT"));
    mockMvc
        .perform(post("/v1/events/broken/registrations").header("X-User-Id", "user-1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("SYSTEM_ERROR"))
        .andExpect(jsonPath("$.message").value("ticket could not be issued"));
  }

  @Test
  void storeFailureMapsToSystemErrorWithoutInternalMessage() throws Exception {
    when(registrationService.register(eq("event-1"), eq("user-1"), any()))
        .thenThrow(new DataAccessResourceFailureException("connection to db-host:5432 refused"));

    mockMvc
        .perform(post("/v1/events/event-1/registrations").header("X-User-Id", "user-1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("SYSTEM_ERROR"))
        .andExpect(jsonPath("$.message").value("registration store is unavailable"));
  }

  @Test
  void cancelReturnsPromotedRegistration() throws Exception {
    when(registrationService.cancel(eq("event-1"), eq("user-1"), any()))
        .thenReturn(
            new CancelRegistrationResponse(
                REGISTRATION_ID, "event-1", "user-1", "CONFIRMED", CREATED_AT, PROMOTED_ID));

    mockMvc
        .perform(delete("/v1/events/event-1/registrations").header("X-User-Id", "user-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.previous_status").value("CONFIRMED"))
        .andExpect(jsonPath("$.promoted_registration_id").value(PROMOTED_ID.toString()));
  }

  @Test
  void cancelReturnsNotFoundWithoutActiveRegistration() throws Exception {
    when(registrationService.cancel(eq("event-1"), eq("user-1"), any()))
        .thenThrow(new RegistrationNotFoundException("event-1", "user-1"));

    mockMvc
        .perform(delete("/v1/events/event-1/registrations").header("X-User-Id", "user-1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("REGISTRATION_NOT_FOUND"));
  }

  @Test
  void findRegistrationReturnsCurrentState() throws Exception {
    when(registrationService.findRegistration("event-1", "user-1"))
        .thenReturn(
            new RegistrationResponse(
                REGISTRATION_ID, "event-1", "user-1", "WAITLISTED", null, 1, CREATED_AT));

    mockMvc
        .perform(get("/v1/events/event-1/registrations/user-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.waitlist_position").value(1));
  }

  @Test
  void attendeesReturnsCounts() throws Exception {
    when(registrationService.listAttendees("event-1"))
        .thenReturn(
            new AttendeesResponse(
                "event-1",
                2,
                2,
                1,
                List.of(
                    new AttendeeSummary(REGISTRATION_ID, "user-1", "WAITLISTED", CREATED_AT, null))));

    mockMvc
        .perform(get("/v1/events/event-1/attendees"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.capacity").value(2))
        .andExpect(jsonPath("$.confirmed_count").value(2))
        .andExpect(jsonPath("$.waitlisted_count").value(1))
        .andExpect(jsonPath("$.attendees[0].user_id").value("user-1"));
  }

  @Test
  void listByUserReturnsRegistrations() throws Exception {
    when(registrationService.listByUser("user-1"))
        .thenReturn(
            new UserRegistrationsResponse(
                "user-1",
                List.of(
                    new RegistrationSummary(
                        REGISTRATION_ID, "event-1", "CONFIRMED", CREATED_AT, null))));

    mockMvc
        .perform(get("/v1/users/user-1/registrations"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("user-1"))
        .andExpect(jsonPath("$.registrations[0].event_id").value("event-1"));
  }
}
