/*
 * どこで: SiteMonitor データアクセス
 * 何を: サイトごとの通知チャネル設定を notifiers テーブルに保存する
 * なぜ: notifier 設定サービスがこの行から hub を再構築するため
 */
package com.example.sitemonitor.repository;

import com.example.sitemonitor.notifier.Notifier;
import com.example.sitemonitor.notifier.NotifierConfig;
import com.example.sitemonitor.notifier.NotifierType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotifierRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Notifier insert(long siteId, NotifierConfig config) {
    final String sql =
        """
        INSERT INTO notifiers (site_id, type, config)
        VALUES (:siteId, :type, :config::jsonb)
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("siteId", siteId)
            .addValue("type", config.type().name())
            .addValue("config", config.configJson());
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("notifier insert returned no id siteId=" + siteId);
    }
    return new Notifier(id, siteId, config);
  }

  public Optional<Notifier> findById(long id) {
    final String sql =
        """
        SELECT id, site_id, type, config::text AS config_text
        FROM notifiers
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<Notifier> findBySiteId(long siteId) {
    final String sql =
        """
        SELECT id, site_id, type, config::text AS config_text
        FROM notifiers
        WHERE site_id = :siteId
        ORDER BY id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("siteId", siteId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<Notifier> updateConfig(long id, NotifierConfig config) {
    final String sql =
        """
        UPDATE notifiers
        SET type = :type,
            config = :config::jsonb
        WHERE id = :id
        RETURNING id, site_id, type, config::text AS config_text
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("type", config.type().name())
            .addValue("config", config.configJson());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int delete(long id) {
    final String sql = "DELETE FROM notifiers WHERE id = :id";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  private Notifier mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Notifier(
        rs.getLong("id"),
        rs.getLong("site_id"),
        new NotifierConfig(
            NotifierType.valueOf(rs.getString("type")), rs.getString("config_text")));
  }
}
