/*
 * どこで: Registration データアクセス
 * 何を: registration_audit の登録/参照を行う
 * なぜ: 登録/取消/昇格の履歴を追跡できるようにするため
 */
package com.eventportal.registration.repository;

import static com.eventportal.common.JdbcTimestampUtils.toInstant;
import static com.eventportal.common.JdbcTimestampUtils.toTimestamp;

import com.eventportal.registration.model.RegistrationAuditRecord;
import com.eventportal.registration.model.RegistrationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RegistrationAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(RegistrationAuditRecord record) {
    String sql = """
        INSERT INTO registration_audit (
          audit_id,
          occurred_at,
          registration_id,
          event_id,
          user_id,
          action,
          from_status,
          to_status,
          trace_id
        ) VALUES (
          :auditId,
          :occurredAt,
          :registrationId,
          :eventId,
          :userId,
          :action,
          :fromStatus,
          :toStatus,
          :traceId
        )
        """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("auditId", record.auditId())
        .addValue("occurredAt", toTimestamp(record.occurredAt()))
        .addValue("registrationId", record.registrationId())
        .addValue("eventId", record.eventId())
        .addValue("userId", record.userId())
        .addValue("action", record.action())
        .addValue("fromStatus", record.fromStatus() == null ? null : record.fromStatus().name())
        .addValue("toStatus", record.toStatus().name())
        .addValue("traceId", record.traceId());
    return jdbcTemplate.update(sql, params);
  }

  // 監査確認用。登録ワークフローからは参照しない
  public List<RegistrationAuditRecord> findByRegistrationId(UUID registrationId) {
    String sql = """
        SELECT audit_id, occurred_at, registration_id, event_id, user_id,
               action, from_status, to_status, trace_id
        FROM registration_audit
        WHERE registration_id = :registrationId
        ORDER BY occurred_at
        """;
    MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("registrationId", registrationId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private RegistrationAuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String fromStatus = rs.getString("from_status");
    return new RegistrationAuditRecord(
        rs.getObject("audit_id", UUID.class),
        toInstant(rs.getTimestamp("occurred_at")),
        rs.getObject("registration_id", UUID.class),
        rs.getString("event_id"),
        rs.getString("user_id"),
        rs.getString("action"),
        fromStatus == null ? null : RegistrationStatus.valueOf(fromStatus),
        RegistrationStatus.valueOf(rs.getString("to_status")),
        rs.getString("trace_id"));
  }
}
