/*
 * どこで: Registration サービス層
 * 何を: 参加登録/取消とキャンセル待ちからの繰り上げ (FIFO) を担う
 * なぜ: 定員判定と状態遷移をイベント単位のトランザクション内で整合させるため
 */
package com.eventportal.registration.service;

import com.eventportal.common.TraceIds;
import com.eventportal.registration.api.AttendeeSummary;
import com.eventportal.registration.api.AttendeesResponse;
import com.eventportal.registration.api.CancelRegistrationResponse;
import com.eventportal.registration.api.DuplicateRegistrationException;
import com.eventportal.registration.api.EventNotFoundException;
import com.eventportal.registration.api.RegistrationConflictException;
import com.eventportal.registration.api.RegistrationDeadlinePassedException;
import com.eventportal.registration.api.RegistrationNotFoundException;
import com.eventportal.registration.api.RegistrationResponse;
import com.eventportal.registration.api.RegistrationSummary;
import com.eventportal.registration.api.TicketIssuanceException;
import com.eventportal.registration.api.UserRegistrationsResponse;
import com.eventportal.registration.config.RegistrationProperties;
import com.eventportal.registration.model.EventRecord;
import com.eventportal.registration.model.RegistrationAuditRecord;
import com.eventportal.registration.model.RegistrationRecord;
import com.eventportal.registration.model.RegistrationStatus;
import com.eventportal.registration.repository.EventLockRepository;
import com.eventportal.registration.repository.EventRepository;
import com.eventportal.registration.repository.RegistrationAuditRepository;
import com.eventportal.registration.repository.RegistrationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class RegistrationService {

  private static final Logger logger = LoggerFactory.getLogger(RegistrationService.class);

  static final String ACTION_REGISTER = "REGISTER";
  static final String ACTION_CANCEL = "CANCEL";
  static final String ACTION_PROMOTE = "PROMOTE";
  static final String RESULT_SUCCESS = "success";
  static final String RESULT_REJECTED = "rejected";
  static final String RESULT_CONFLICT = "conflict";
  static final String RESULT_ERROR = "error";

  private final TransactionTemplate transactionTemplate;
  private final EventRepository eventRepository;
  private final RegistrationRepository registrationRepository;
  private final RegistrationAuditRepository auditRepository;
  private final EventLockRepository eventLockRepository;
  private final EventLockKeyGenerator lockKeyGenerator;
  private final TicketIssuer ticketIssuer;
  private final RegistrationProperties properties;
  private final RegistrationMetrics metrics;
  private final Clock clock;

  public RegistrationResponse register(String eventId, String userId) {
    return register(eventId, userId, null);
  }

  public RegistrationResponse register(String eventId, String userId, String traceId) {
    final String resolvedTraceId = TraceIds.resolve(traceId);
    return runCommand(
        ACTION_REGISTER, eventId, () -> registerInTransaction(eventId, userId, resolvedTraceId));
  }

  public CancelRegistrationResponse cancel(String eventId, String userId) {
    return cancel(eventId, userId, null);
  }

  public CancelRegistrationResponse cancel(String eventId, String userId, String traceId) {
    final String resolvedTraceId = TraceIds.resolve(traceId);
    return runCommand(
        ACTION_CANCEL, eventId, () -> cancelInTransaction(eventId, userId, resolvedTraceId));
  }

  @Transactional(readOnly = true)
  public RegistrationResponse findRegistration(String eventId, String userId) {
    final RegistrationRecord active =
        registrationRepository
            .findActive(eventId, userId)
            .orElseThrow(() -> new RegistrationNotFoundException(eventId, userId));
    return toResponse(active, waitlistPositionOf(active));
  }

  @Transactional(readOnly = true)
  public AttendeesResponse listAttendees(String eventId) {
    final EventRecord event =
        eventRepository.findById(eventId).orElseThrow(() -> new EventNotFoundException(eventId));
    final List<AttendeeSummary> attendees =
        registrationRepository.findByEventId(eventId).stream()
            .map(
                record ->
                    new AttendeeSummary(
                        record.registrationId(),
                        record.userId(),
                        record.status().name(),
                        record.createdAt(),
                        record.cancelledAt()))
            .toList();
    return new AttendeesResponse(
        eventId,
        event.capacity(),
        registrationRepository.countConfirmed(eventId),
        registrationRepository.countWaitlisted(eventId),
        attendees);
  }

  @Transactional(readOnly = true)
  public UserRegistrationsResponse listByUser(String userId) {
    final List<RegistrationSummary> items =
        registrationRepository.findByUserId(userId).stream()
            .map(
                record ->
                    new RegistrationSummary(
                        record.registrationId(),
                        record.eventId(),
                        record.status().name(),
                        record.createdAt(),
                        record.cancelledAt()))
            .toList();
    return new UserRegistrationsResponse(userId, items);
  }

  private <T> T runCommand(String action, String eventId, Supplier<T> work) {
    int attempt = 0;
    while (true) {
      try {
        // 1 回の試行 = 1 トランザクション。例外時は全体がロールバックされる
        final T result = transactionTemplate.execute(status -> work.get());
        metrics.recordCommand(action, RESULT_SUCCESS);
        return result;
      } catch (TransientDataAccessException | DuplicateKeyException ex) {
        if (attempt >= properties.conflictRetries()) {
          metrics.recordCommand(action, RESULT_CONFLICT);
          logger.warn(
              "registration conflict not resolved: action={} event_id={} attempts={}",
              action,
              eventId,
              attempt + 1,
              ex);
          throw new RegistrationConflictException(
              "concurrent update conflict: event_id=" + eventId, ex);
        }
        attempt++;
        metrics.recordConflictRetry();
        logger.warn(
            "transient conflict, retrying: action={} event_id={} retry={} cause={}",
            action,
            eventId,
            attempt,
            ex.getMessage());
      } catch (DataAccessException ex) {
        // 一時的でない DB 障害は再試行せずシステムエラーとして返す
        metrics.recordCommand(action, RESULT_ERROR);
        logger.error("registration store failed: action={} event_id={}", action, eventId, ex);
        throw ex;
      } catch (EventNotFoundException
          | RegistrationDeadlinePassedException
          | DuplicateRegistrationException
          | RegistrationNotFoundException ex) {
        metrics.recordCommand(action, RESULT_REJECTED);
        throw ex;
      } catch (TicketIssuanceException ex) {
        metrics.recordCommand(action, RESULT_ERROR);
        logger.error("ticket issuance failed: action={} event_id={}", action, eventId, ex);
        throw ex;
      }
    }
  }

  private RegistrationResponse registerInTransaction(
      String eventId, String userId, String traceId) {
    lockEvent(eventId);
    if (registrationRepository.findActive(eventId, userId).isPresent()) {
      throw new DuplicateRegistrationException(eventId, userId);
    }
    final EventRecord event =
        eventRepository.findById(eventId).orElseThrow(() -> new EventNotFoundException(eventId));
    final Instant now = Instant.now(clock);
    if (event.isRegistrationClosedAt(now)) {
      throw new RegistrationDeadlinePassedException(eventId, event.registrationDeadline());
    }
    final int confirmed = registrationRepository.countConfirmed(eventId);
    final UUID registrationId = UUID.randomUUID();
    final RegistrationRecord record;
    Integer position = null;
    if (event.hasRoomFor(confirmed)) {
      final String ticket = issueTicket(registrationId, eventId, userId);
      record =
          registrationRepository.insert(
              registrationId, eventId, userId, RegistrationStatus.CONFIRMED, ticket, now);
    } else {
      record =
          registrationRepository.insert(
              registrationId, eventId, userId, RegistrationStatus.WAITLISTED, null, now);
      position = waitlistPositionOf(record);
    }
    auditRepository.insert(buildAuditRecord(record, ACTION_REGISTER, null, traceId, now));
    logger.info(
        "registration accepted: event_id={} user_id={} registration_id={} status={}",
        eventId,
        userId,
        record.registrationId(),
        record.status());
    return toResponse(record, position);
  }

  private CancelRegistrationResponse cancelInTransaction(
      String eventId, String userId, String traceId) {
    lockEvent(eventId);
    final RegistrationRecord active =
        registrationRepository
            .findActive(eventId, userId)
            .orElseThrow(() -> new RegistrationNotFoundException(eventId, userId));
    final Instant now = Instant.now(clock);
    final RegistrationRecord cancelled =
        registrationRepository
            .markCancelled(active.registrationId(), active.status(), now)
            .orElseThrow(
                () ->
                    new ConcurrencyFailureException(
                        "registration changed concurrently: " + active.registrationId()));
    auditRepository.insert(
        buildAuditRecord(cancelled, ACTION_CANCEL, active.status(), traceId, now));
    UUID promotedRegistrationId = null;
    if (active.status() == RegistrationStatus.CONFIRMED) {
      promotedRegistrationId =
          promoteNext(eventId, traceId, now).map(RegistrationRecord::registrationId).orElse(null);
    }
    logger.info(
        "registration cancelled: event_id={} user_id={} registration_id={} previous_status={}"
            + " promoted_registration_id={}",
        eventId,
        userId,
        cancelled.registrationId(),
        active.status(),
        promotedRegistrationId);
    return new CancelRegistrationResponse(
        cancelled.registrationId(),
        eventId,
        userId,
        active.status().name(),
        cancelled.cancelledAt(),
        promotedRegistrationId);
  }

  private Optional<RegistrationRecord> promoteNext(String eventId, String traceId, Instant now) {
    final Optional<RegistrationRecord> next = registrationRepository.findEarliestWaitlisted(eventId);
    if (next.isEmpty()) {
      return Optional.empty();
    }
    final EventRecord event =
        eventRepository
            .findById(eventId)
            .orElseThrow(() -> new IllegalStateException("event not found: " + eventId));
    // 定員が外部で引き下げられていても確定数を超えて繰り上げない
    final int confirmed = registrationRepository.countConfirmed(eventId);
    if (!event.hasRoomFor(confirmed)) {
      logger.info(
          "promotion skipped, event is full: event_id={} confirmed={} capacity={}",
          eventId,
          confirmed,
          event.capacity());
      return Optional.empty();
    }
    final RegistrationRecord waiting = next.get();
    final String ticket = issueTicket(waiting.registrationId(), eventId, waiting.userId());
    final RegistrationRecord promoted =
        registrationRepository
            .markConfirmed(waiting.registrationId(), ticket, now)
            .orElseThrow(
                () ->
                    new ConcurrencyFailureException(
                        "registration changed concurrently: " + waiting.registrationId()));
    auditRepository.insert(
        buildAuditRecord(promoted, ACTION_PROMOTE, RegistrationStatus.WAITLISTED, traceId, now));
    afterCommit(metrics::recordPromotion);
    logger.info(
        "registration promoted: event_id={} user_id={} registration_id={}",
        eventId,
        promoted.userId(),
        promoted.registrationId());
    return Optional.of(promoted);
  }

  private void lockEvent(String eventId) {
    eventLockRepository.applyLockTimeout(properties.lockTimeout());
    eventLockRepository.lockEvent(lockKeyGenerator.generate(eventId));
  }

  private String issueTicket(UUID registrationId, String eventId, String userId) {
    try {
      return ticketIssuer.issue(registrationId, eventId, userId);
    } catch (TicketIssuanceException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new TicketIssuanceException(
          "failed to issue ticket: registration_id=" + registrationId, ex);
    }
  }

  private Integer waitlistPositionOf(RegistrationRecord record) {
    if (record.status() != RegistrationStatus.WAITLISTED) {
      return null;
    }
    return registrationRepository.countWaitlistedUpTo(
        record.eventId(), record.createdAt(), record.registrationSeq());
  }

  private void afterCommit(Runnable action) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      action.run();
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCommit() {
            action.run();
          }
        });
  }

  private RegistrationAuditRecord buildAuditRecord(
      RegistrationRecord record,
      String action,
      RegistrationStatus fromStatus,
      String traceId,
      Instant now) {
    return new RegistrationAuditRecord(
        UUID.randomUUID(),
        now,
        record.registrationId(),
        record.eventId(),
        record.userId(),
        action,
        fromStatus,
        record.status(),
        traceId);
  }

  private RegistrationResponse toResponse(RegistrationRecord record, Integer waitlistPosition) {
    return new RegistrationResponse(
        record.registrationId(),
        record.eventId(),
        record.userId(),
        record.status().name(),
        record.ticket(),
        waitlistPosition,
        record.createdAt());
  }
}
