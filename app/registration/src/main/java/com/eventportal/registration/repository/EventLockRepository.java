/*
 * どこで: Registration データアクセス
 * 何を: イベント単位の advisory lock とロック待ち上限を設定する
 * なぜ: 同一イベントの定員判定と書き込みをトランザクション内で直列化するため
 */
package com.eventportal.registration.repository;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class EventLockRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void applyLockTimeout(Duration lockTimeout) {
    // is_local = true でトランザクション終了時に元へ戻る
    final String sql = "SELECT set_config('lock_timeout', :lockTimeout, true)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("lockTimeout", lockTimeout.toMillis() + "ms");
    jdbcTemplate.query(sql, params, rs -> null);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockEvent(long lockKey) {
    // 64-bit の advisory lock を使い、別イベント同士は競合させない。
    // ロックはコミット/ロールバックで自動解放される。
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }
}
