/*
 * どこで: PVP データアクセス
 * 何を: pvp_matches の登録/参照と状態遷移を行う
 * なぜ: 状態遷移を UPDATE ... WHERE status で条件付きにし、競合の敗者を空結果で返すため
 */
package com.example.pvp.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.pvp.model.MatchFinish;
import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.MatchStatus;
import com.example.pvp.model.MatchType;
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
public class JdbcMatchRepository implements MatchRepository {

  private static final String RETURNING_COLUMNS =
      """
      match_id, match_type, season_id, player_a_id, player_b_id, player_a_rating,
      player_b_rating, status, score_a, score_b, winner_id, moves_a, moves_b, duration_seconds,
      spectator_count, allow_spectate, created_at, started_at, finished_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(MatchRecord match) {
    final String sql =
        """
        INSERT INTO pvp_matches (
          match_id, match_type, season_id, player_a_id, player_b_id, player_a_rating,
          player_b_rating, status, score_a, score_b, winner_id, moves_a, moves_b,
          duration_seconds, spectator_count, allow_spectate, created_at, started_at, finished_at
        ) VALUES (
          :matchId, :matchType, :seasonId, :playerAId, :playerBId, :playerARating,
          :playerBRating, :status, :scoreA, :scoreB, :winnerId, :movesA, :movesB,
          :durationSeconds, :spectatorCount, :allowSpectate, :createdAt, :startedAt, :finishedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("matchId", match.matchId())
            .addValue("matchType", match.matchType().name())
            .addValue("seasonId", match.seasonId())
            .addValue("playerAId", match.playerAId())
            .addValue("playerBId", match.playerBId())
            .addValue("playerARating", match.playerARating())
            .addValue("playerBRating", match.playerBRating())
            .addValue("status", match.status().name())
            .addValue("scoreA", match.scoreA())
            .addValue("scoreB", match.scoreB())
            .addValue("winnerId", match.winnerId())
            .addValue("movesA", match.movesA())
            .addValue("movesB", match.movesB())
            .addValue("durationSeconds", match.durationSeconds())
            .addValue("spectatorCount", match.spectatorCount())
            .addValue("allowSpectate", match.allowSpectate())
            .addValue("createdAt", toTimestamp(match.createdAt()))
            .addValue("startedAt", toTimestamp(match.startedAt()))
            .addValue("finishedAt", toTimestamp(match.finishedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<MatchRecord> findById(String matchId) {
    final String sql =
        "SELECT " + RETURNING_COLUMNS + " FROM pvp_matches WHERE match_id = :matchId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("matchId", matchId), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public Optional<MatchRecord> transitionToActive(String matchId, Instant startedAt) {
    // WAITING 以外なら更新せず、空結果を返す
    final String sql =
        """
        UPDATE pvp_matches
        SET status = 'ACTIVE',
            started_at = :startedAt
        WHERE match_id = :matchId AND status = 'WAITING'
        RETURNING
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("matchId", matchId)
            .addValue("startedAt", toTimestamp(startedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<MatchRecord> transitionToFinished(String matchId, MatchFinish finish) {
    // ACTIVE 以外なら更新せず、空結果を返す
    final String sql =
        """
        UPDATE pvp_matches
        SET status = 'FINISHED',
            winner_id = :winnerId,
            score_a = :scoreA,
            score_b = :scoreB,
            moves_a = :movesA,
            moves_b = :movesB,
            duration_seconds = :durationSeconds,
            finished_at = :finishedAt
        WHERE match_id = :matchId AND status = 'ACTIVE'
        RETURNING
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("matchId", matchId)
            .addValue("winnerId", finish.winnerId())
            .addValue("scoreA", finish.scoreA())
            .addValue("scoreB", finish.scoreB())
            .addValue("movesA", finish.movesA())
            .addValue("movesB", finish.movesB())
            .addValue("durationSeconds", finish.durationSeconds())
            .addValue("finishedAt", toTimestamp(finish.finishedAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<MatchRecord> adjustSpectatorCount(String matchId, int delta) {
    final String sql =
        """
        UPDATE pvp_matches
        SET spectator_count = GREATEST(spectator_count + :delta, 0)
        WHERE match_id = :matchId
        RETURNING
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("matchId", matchId).addValue("delta", delta);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<MatchRecord> findActive(int limit) {
    final String sql =
        "SELECT "
            + RETURNING_COLUMNS
            + """
             FROM pvp_matches
            WHERE status IN ('WAITING', 'ACTIVE')
            ORDER BY created_at DESC, match_id ASC
            LIMIT :limit
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), this::mapRow);
  }

  @Override
  public List<MatchRecord> findFinishedByPlayer(String playerId, int limit) {
    final String sql =
        "SELECT "
            + RETURNING_COLUMNS
            + """
             FROM pvp_matches
            WHERE status = 'FINISHED'
              AND (player_a_id = :playerId OR player_b_id = :playerId)
            ORDER BY finished_at DESC, match_id ASC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("playerId", playerId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MatchRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MatchRecord(
        rs.getString("match_id"),
        MatchType.valueOf(rs.getString("match_type")),
        rs.getString("season_id"),
        rs.getString("player_a_id"),
        rs.getString("player_b_id"),
        rs.getInt("player_a_rating"),
        rs.getInt("player_b_rating"),
        MatchStatus.valueOf(rs.getString("status")),
        rs.getInt("score_a"),
        rs.getInt("score_b"),
        rs.getString("winner_id"),
        rs.getInt("moves_a"),
        rs.getInt("moves_b"),
        rs.getLong("duration_seconds"),
        rs.getInt("spectator_count"),
        rs.getBoolean("allow_spectate"),
        getInstant(rs, "created_at"),
        getInstant(rs, "started_at"),
        getInstant(rs, "finished_at"));
  }
}
