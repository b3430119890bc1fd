/*
 * どこで: Registration データアクセス
 * 何を: events から定員/締切を参照する
 * なぜ: 登録判定をイベント管理側の実装から切り離すため
 */
package com.eventportal.registration.repository;

import static com.eventportal.common.JdbcTimestampUtils.toInstant;
import static com.eventportal.common.JdbcTimestampUtils.toTimestamp;

import com.eventportal.registration.model.EventRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<EventRecord> findById(String eventId) {
    final String sql =
        """
        SELECT event_id, title, capacity, registration_deadline
        FROM events
        WHERE event_id = :eventId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // イベント本体は別サービスが登録する。ここではテストデータ投入用
  public int insert(EventRecord event) {
    final String sql =
        """
        INSERT INTO events (
          event_id,
          title,
          capacity,
          registration_deadline
        ) VALUES (
          :eventId,
          :title,
          :capacity,
          :registrationDeadline
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", event.eventId())
            .addValue("title", event.title())
            .addValue("capacity", event.capacity())
            .addValue("registrationDeadline", toTimestamp(event.registrationDeadline()));
    return jdbcTemplate.update(sql, params);
  }

  private EventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    // capacity が NULL のイベントは定員なしとして扱う
    return new EventRecord(
        rs.getString("event_id"),
        rs.getString("title"),
        rs.getObject("capacity", Integer.class),
        toInstant(rs.getTimestamp("registration_deadline")));
  }
}
