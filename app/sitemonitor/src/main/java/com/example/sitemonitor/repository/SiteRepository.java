/*
 * どこで: SiteMonitor データアクセス
 * 何を: sites テーブルの行を登録・参照する
 * なぜ: スケジューラが監視する永続化済みサイト定義を供給するため
 */
package com.example.sitemonitor.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.sitemonitor.model.SiteRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SiteRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(String url, Duration interval, boolean enabled, Instant createdAt) {
    final String sql =
        """
        INSERT INTO sites (url, interval_ms, enabled, created_at)
        VALUES (:url, :intervalMs, :enabled, :createdAt)
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("url", url)
            .addValue("intervalMs", interval.toMillis())
            .addValue("enabled", enabled)
            .addValue("createdAt", toTimestamp(createdAt));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("site insert returned no id url=" + url);
    }
    return id;
  }

  public List<SiteRecord> findAll() {
    final String sql =
        """
        SELECT id, url, interval_ms, enabled, created_at
        FROM sites
        ORDER BY id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<SiteRecord> findById(long id) {
    final String sql =
        """
        SELECT id, url, interval_ms, enabled, created_at
        FROM sites
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private SiteRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SiteRecord(
        rs.getLong("id"),
        rs.getString("url"),
        Duration.ofMillis(rs.getLong("interval_ms")),
        rs.getBoolean("enabled"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
