package com.example.pvp.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.pvp.model.SpectatorRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pvp.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcSpectatorRepository implements SpectatorRepository {

  private static final String COLUMNS = "spectator_id, match_id, player_id, joined_at, left_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(SpectatorRecord spectator) {
    final String sql =
        """
        INSERT INTO pvp_spectators (spectator_id, match_id, player_id, joined_at, left_at)
        VALUES (:spectatorId, :matchId, :playerId, :joinedAt, :leftAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("spectatorId", spectator.spectatorId())
            .addValue("matchId", spectator.matchId())
            .addValue("playerId", spectator.playerId())
            .addValue("joinedAt", toTimestamp(spectator.joinedAt()))
            .addValue("leftAt", toTimestamp(spectator.leftAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<SpectatorRecord> findById(String spectatorId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM pvp_spectators WHERE spectator_id = :spectatorId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("spectatorId", spectatorId), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public Optional<SpectatorRecord> findActive(String matchId, String playerId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM pvp_spectators"
            + " WHERE match_id = :matchId AND player_id = :playerId AND left_at IS NULL";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("matchId", matchId).addValue("playerId", playerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<SpectatorRecord> markLeft(String spectatorId, Instant leftAt) {
    // 既に退出済みなら更新せず、空結果を返す
    final String sql =
        "UPDATE pvp_spectators SET left_at = :leftAt"
            + " WHERE spectator_id = :spectatorId AND left_at IS NULL"
            + " RETURNING "
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("spectatorId", spectatorId)
            .addValue("leftAt", toTimestamp(leftAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<SpectatorRecord> findActiveByMatch(String matchId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM pvp_spectators WHERE match_id = :matchId AND left_at IS NULL"
            + " ORDER BY joined_at ASC, spectator_id ASC";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("matchId", matchId), this::mapRow);
  }

  private SpectatorRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SpectatorRecord(
        rs.getString("spectator_id"),
        rs.getString("match_id"),
        rs.getString("player_id"),
        getInstant(rs, "joined_at"),
        getInstant(rs, "left_at"));
  }
}
