/*
 * どこで: PVP データアクセス
 * 何を: pvp_rankings の参照/作成/更新と順位計算を行う
 * なぜ: 結果確定時の read-modify-write を行ロック付きで一貫させるため
 */
package com.example.pvp.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.pvp.model.PlayerRankingRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
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
public class JdbcPlayerRankingRepository implements PlayerRankingRepository {

  private static final String COLUMNS =
      """
      player_id, season_id, rating, max_rating, matches_played, matches_won, matches_lost,
      matches_drawn, current_streak, max_streak, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<PlayerRankingRecord> find(String playerId, String seasonId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM pvp_rankings WHERE player_id = :playerId AND season_id = :seasonId";
    return jdbcTemplate.query(sql, keyParams(playerId, seasonId), this::mapRow).stream()
        .findFirst();
  }

  @Override
  public Optional<PlayerRankingRecord> findForUpdate(String playerId, String seasonId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM pvp_rankings WHERE player_id = :playerId AND season_id = :seasonId FOR UPDATE";
    return jdbcTemplate.query(sql, keyParams(playerId, seasonId), this::mapRow).stream()
        .findFirst();
  }

  @Override
  public void createIfAbsent(PlayerRankingRecord initial) {
    final String sql =
        """
        INSERT INTO pvp_rankings (
          player_id, season_id, rating, max_rating, matches_played, matches_won, matches_lost,
          matches_drawn, current_streak, max_streak, updated_at
        ) VALUES (
          :playerId, :seasonId, :rating, :maxRating, 0, 0, 0, 0, 0, 0, :updatedAt
        )
        ON CONFLICT (player_id, season_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        keyParams(initial.playerId(), initial.seasonId())
            .addValue("rating", initial.rating())
            .addValue("maxRating", initial.maxRating())
            .addValue("updatedAt", toTimestamp(initial.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public void update(PlayerRankingRecord ranking) {
    final String sql =
        """
        UPDATE pvp_rankings
        SET rating = :rating,
            max_rating = :maxRating,
            matches_played = :matchesPlayed,
            matches_won = :matchesWon,
            matches_lost = :matchesLost,
            matches_drawn = :matchesDrawn,
            current_streak = :currentStreak,
            max_streak = :maxStreak,
            updated_at = :updatedAt
        WHERE player_id = :playerId AND season_id = :seasonId
        """;
    final MapSqlParameterSource params =
        keyParams(ranking.playerId(), ranking.seasonId())
            .addValue("rating", ranking.rating())
            .addValue("maxRating", ranking.maxRating())
            .addValue("matchesPlayed", ranking.matchesPlayed())
            .addValue("matchesWon", ranking.matchesWon())
            .addValue("matchesLost", ranking.matchesLost())
            .addValue("matchesDrawn", ranking.matchesDrawn())
            .addValue("currentStreak", ranking.currentStreak())
            .addValue("maxStreak", ranking.maxStreak())
            .addValue("updatedAt", toTimestamp(ranking.updatedAt()));
    final int updated = jdbcTemplate.update(sql, params);
    if (updated != 1) {
      throw new IllegalStateException(
          "ranking row missing: player_id="
              + ranking.playerId()
              + " season_id="
              + ranking.seasonId());
    }
  }

  @Override
  public long countWithHigherRating(String seasonId, int rating) {
    final String sql =
        "SELECT COUNT(*) FROM pvp_rankings WHERE season_id = :seasonId AND rating > :rating";
    final Long count =
        jdbcTemplate.queryForObject(
            sql,
            new MapSqlParameterSource().addValue("seasonId", seasonId).addValue("rating", rating),
            Long.class);
    return count == null ? 0 : count;
  }

  @Override
  public List<PlayerRankingRecord> findPage(String seasonId, int limit, int offset) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM pvp_rankings
            WHERE season_id = :seasonId
            ORDER BY rating DESC, player_id ASC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("seasonId", seasonId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MapSqlParameterSource keyParams(String playerId, String seasonId) {
    return new MapSqlParameterSource()
        .addValue("playerId", playerId)
        .addValue("seasonId", seasonId);
  }

  private PlayerRankingRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PlayerRankingRecord(
        rs.getString("player_id"),
        rs.getString("season_id"),
        rs.getInt("rating"),
        rs.getInt("max_rating"),
        rs.getInt("matches_played"),
        rs.getInt("matches_won"),
        rs.getInt("matches_lost"),
        rs.getInt("matches_drawn"),
        rs.getInt("current_streak"),
        rs.getInt("max_streak"),
        getInstant(rs, "updated_at"));
  }
}
