/*
 * どこで: EventRepository の統合テスト
 * 何を: 定員なし/締切なしを含むイベント属性の読み出しを検証する
 */
package com.eventportal.registration.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.eventportal.registration.AbstractPostgresContainerTest;
import com.eventportal.registration.model.EventRecord;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class EventRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private EventRepository eventRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM registration_audit", params);
    jdbcTemplate.update("DELETE FROM registrations", params);
    jdbcTemplate.update("DELETE FROM events", params);
  }

  @Test
  void findByIdReadsCapacityAndDeadline() {
    final Instant deadline = Instant.parse("2026-04-01T00:00:00Z");
    eventRepository.insert(new EventRecord("event-1", "Meetup", 30, deadline));
    eventRepository.insert(new EventRecord("event-2", "Open house", null, null));

    final Optional<EventRecord> bounded = eventRepository.findById("event-1");
    final Optional<EventRecord> unbounded = eventRepository.findById("event-2");

    assertThat(bounded).contains(new EventRecord("event-1", "Meetup", 30, deadline));
    assertThat(unbounded).isPresent();
    assertThat(unbounded.get().isUnbounded()).isTrue();
    assertThat(unbounded.get().registrationDeadline()).isNull();
    assertThat(eventRepository.findById("missing")).isEmpty();
  }
}
