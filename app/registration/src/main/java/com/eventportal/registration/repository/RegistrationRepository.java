/*
 * どこで: Registration データアクセス
 * 何を: registrations の登録/状態更新/参照を行う
 * なぜ: 定員判定と FIFO 昇格を常に DB の行から導出するため
 */
package com.eventportal.registration.repository;

import static com.eventportal.common.JdbcTimestampUtils.toInstant;
import static com.eventportal.common.JdbcTimestampUtils.toTimestamp;

import com.eventportal.registration.model.RegistrationRecord;
import com.eventportal.registration.model.RegistrationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RegistrationRepository {

  private static final String COLUMNS =
      """
      registration_id, registration_seq, event_id, user_id, status, ticket,
      created_at, updated_at, cancelled_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public RegistrationRecord insert(
      UUID registrationId,
      String eventId,
      String userId,
      RegistrationStatus status,
      String ticket,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO registrations (
          registration_id,
          event_id,
          user_id,
          status,
          ticket,
          created_at,
          updated_at
        ) VALUES (
          :registrationId,
          :eventId,
          :userId,
          :status,
          :ticket,
          :createdAt,
          :createdAt
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("registrationId", registrationId)
            .addValue("eventId", eventId)
            .addValue("userId", userId)
            .addValue("status", status.name())
            .addValue("ticket", ticket)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<RegistrationRecord> findActive(String eventId, String userId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM registrations
            WHERE event_id = :eventId
              AND user_id = :userId
              AND status IN ('CONFIRMED', 'WAITLISTED')
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("eventId", eventId).addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countConfirmed(String eventId) {
    return countByStatus(eventId, RegistrationStatus.CONFIRMED);
  }

  public int countWaitlisted(String eventId) {
    return countByStatus(eventId, RegistrationStatus.WAITLISTED);
  }

  public Optional<RegistrationRecord> findEarliestWaitlisted(String eventId) {
    // created_at が同値の場合は採番順で先着を決める
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM registrations
            WHERE event_id = :eventId
              AND status = 'WAITLISTED'
            ORDER BY created_at, registration_seq
            LIMIT 1
            FOR UPDATE
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countWaitlistedUpTo(String eventId, Instant createdAt, long registrationSeq) {
    // 自分より前 (同時刻なら採番が小さい) に並んだ WAITLISTED 件数 + 自分自身
    final String sql =
        """
        SELECT COUNT(*)
        FROM registrations
        WHERE event_id = :eventId
          AND status = 'WAITLISTED'
          AND (created_at < :createdAt
               OR (created_at = :createdAt AND registration_seq <= :registrationSeq))
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("createdAt", toTimestamp(createdAt))
            .addValue("registrationSeq", registrationSeq);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public Optional<RegistrationRecord> markCancelled(
      UUID registrationId, RegistrationStatus expectedStatus, Instant cancelledAt) {
    // 期待した状態から変わっていた場合は更新せず、空結果を返す
    final String sql =
        """
        UPDATE registrations
        SET status = 'CANCELLED',
            ticket = NULL,
            cancelled_at = :cancelledAt,
            updated_at = :cancelledAt
        WHERE registration_id = :registrationId
          AND status = :expectedStatus
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("registrationId", registrationId)
            .addValue("expectedStatus", expectedStatus.name())
            .addValue("cancelledAt", toTimestamp(cancelledAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RegistrationRecord> markConfirmed(
      UUID registrationId, String ticket, Instant confirmedAt) {
    // WAITLISTED からの昇格のみ許可する
    final String sql =
        """
        UPDATE registrations
        SET status = 'CONFIRMED',
            ticket = :ticket,
            updated_at = :confirmedAt
        WHERE registration_id = :registrationId
          AND status = 'WAITLISTED'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("registrationId", registrationId)
            .addValue("ticket", ticket)
            .addValue("confirmedAt", toTimestamp(confirmedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<RegistrationRecord> findByEventId(String eventId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM registrations
            WHERE event_id = :eventId
            ORDER BY created_at DESC, registration_seq DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<RegistrationRecord> findByUserId(String userId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM registrations
            WHERE user_id = :userId
            ORDER BY created_at DESC, registration_seq DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private int countByStatus(String eventId, RegistrationStatus status) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM registrations
        WHERE event_id = :eventId
          AND status = :status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("eventId", eventId).addValue("status", status.name());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private RegistrationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RegistrationRecord(
        rs.getObject("registration_id", UUID.class),
        rs.getLong("registration_seq"),
        rs.getString("event_id"),
        rs.getString("user_id"),
        RegistrationStatus.valueOf(rs.getString("status")),
        rs.getString("ticket"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("cancelled_at")));
  }
}
