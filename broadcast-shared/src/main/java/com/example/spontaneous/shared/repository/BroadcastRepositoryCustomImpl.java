package com.example.spontaneous.shared.repository;

import com.example.spontaneous.shared.model.Broadcast;
import com.example.spontaneous.shared.util.Constants.BroadcastStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@RequiredArgsConstructor
public class BroadcastRepositoryCustomImpl implements BroadcastRepositoryCustom {

    private static final char LIKE_ESCAPE = '!';

    private final NamedParameterJdbcTemplate jdbcTemplate;

    private static final RowMapper<Broadcast> BROADCAST_ROW_MAPPER = (rs, rowNum) -> Broadcast.builder()
            .id(rs.getLong("id"))
            .title(rs.getString("title"))
            .description(rs.getString("description"))
            .creatorId(rs.getString("creator_id"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .expiresAt(rs.getObject("expires_at", OffsetDateTime.class))
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
            .status(BroadcastStatus.valueOf(rs.getString("status")))
            .build();

    @Override
    public int updateIfOpen(Long id, String creatorId, BroadcastChanges changes, OffsetDateTime now) {
        List<String> assignments = new ArrayList<>();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("creatorId", creatorId)
                .addValue("now", now);

        if (changes.getTitle() != null) {
            assignments.add("title = :title");
            params.addValue("title", changes.getTitle());
        }
        if (changes.getDescription() != null) {
            assignments.add("description = :description");
            params.addValue("description", changes.getDescription());
        }
        if (changes.getExpiresAt() != null) {
            assignments.add("expires_at = :expiresAt");
            params.addValue("expiresAt", changes.getExpiresAt());
        }
        assignments.add("updated_at = :now");

        String sql = "UPDATE broadcasts SET " + String.join(", ", assignments)
                + " WHERE id = :id AND creator_id = :creatorId AND status = 'ACTIVE' AND expires_at > :now";
        return jdbcTemplate.update(sql, params);
    }

    @Override
    public List<Broadcast> search(BroadcastSearchFilter filter, OffsetDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = buildWhereClause(filter, now, params);
        params.addValue("limit", filter.getLimit());
        params.addValue("offset", filter.getOffset());

        String sql = "SELECT * FROM broadcasts" + where
                + " ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset";
        return jdbcTemplate.query(sql, params, BROADCAST_ROW_MAPPER);
    }

    @Override
    public long countMatching(BroadcastSearchFilter filter, OffsetDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "SELECT COUNT(*) FROM broadcasts" + buildWhereClause(filter, now, params);
        Long total = jdbcTemplate.queryForObject(sql, params, Long.class);
        return total == null ? 0L : total;
    }

    private String buildWhereClause(BroadcastSearchFilter filter, OffsetDateTime now, MapSqlParameterSource params) {
        List<String> conditions = new ArrayList<>();

        if (filter.getKeyword() != null && !filter.getKeyword().isBlank()) {
            conditions.add("(LOWER(title) LIKE :pattern ESCAPE '" + LIKE_ESCAPE + "'"
                    + " OR LOWER(description) LIKE :pattern ESCAPE '" + LIKE_ESCAPE + "')");
            params.addValue("pattern", "%" + escapeLike(filter.getKeyword().trim().toLowerCase(Locale.ROOT)) + "%");
        }
        // status filters on the effective status, so rows the sweeper has not reached yet count as EXPIRED
        if (filter.getStatus() == BroadcastStatus.ACTIVE) {
            conditions.add("status = 'ACTIVE' AND expires_at > :now");
            params.addValue("now", now);
        } else if (filter.getStatus() == BroadcastStatus.EXPIRED) {
            conditions.add("(status = 'EXPIRED' OR expires_at <= :now)");
            params.addValue("now", now);
        }
        if (filter.getCreatedFrom() != null) {
            conditions.add("created_at >= :createdFrom");
            params.addValue("createdFrom", filter.getCreatedFrom());
        }
        if (filter.getCreatedTo() != null) {
            conditions.add("created_at <= :createdTo");
            params.addValue("createdTo", filter.getCreatedTo());
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private static String escapeLike(String keyword) {
        StringBuilder escaped = new StringBuilder(keyword.length());
        for (char c : keyword.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
