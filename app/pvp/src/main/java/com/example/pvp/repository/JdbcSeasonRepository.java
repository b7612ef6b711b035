package com.example.pvp.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;

import com.example.pvp.model.SeasonRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pvp.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcSeasonRepository implements SeasonRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<SeasonRecord> findActiveSeason() {
    final String sql =
        """
        SELECT season_id, season_name, season_number, is_active, start_time, end_time
        FROM seasons
        WHERE is_active = TRUE
        ORDER BY season_number DESC
        LIMIT 1
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow).stream()
        .findFirst();
  }

  private SeasonRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SeasonRecord(
        rs.getString("season_id"),
        rs.getString("season_name"),
        rs.getInt("season_number"),
        rs.getBoolean("is_active"),
        getInstant(rs, "start_time"),
        getInstant(rs, "end_time"));
  }
}
