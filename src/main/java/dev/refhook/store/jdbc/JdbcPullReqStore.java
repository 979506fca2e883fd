package dev.refhook.store.jdbc;

import dev.refhook.domain.entity.PullReq;
import dev.refhook.domain.enums.MergeMethod;
import dev.refhook.domain.enums.PullReqState;
import dev.refhook.store.PullReqStore;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Reads pull requests from the {@code pullreqs} table. The table is written by the
 * pull-request service; this adapter only ever selects.
 */
@Repository
public class JdbcPullReqStore implements PullReqStore {

    private static final String FIND_BY_ID = """
            SELECT pullreq_id, pullreq_number, pullreq_state, pullreq_is_draft, pullreq_title,
                   pullreq_description, pullreq_source_repo_id, pullreq_source_branch,
                   pullreq_target_repo_id, pullreq_target_branch, pullreq_merge_method,
                   pullreq_created, pullreq_updated
            FROM pullreqs
            WHERE pullreq_id = :id
            """;

    private static final RowMapper<PullReq> MAPPER = (rs, rowNum) -> new PullReq(
            rs.getLong("pullreq_id"),
            rs.getLong("pullreq_number"),
            PullReqState.fromValue(rs.getString("pullreq_state")),
            rs.getBoolean("pullreq_is_draft"),
            rs.getString("pullreq_title"),
            rs.getString("pullreq_description"),
            rs.getLong("pullreq_source_repo_id"),
            rs.getString("pullreq_source_branch"),
            rs.getLong("pullreq_target_repo_id"),
            rs.getString("pullreq_target_branch"),
            MergeMethod.fromValue(rs.getString("pullreq_merge_method")),
            rs.getLong("pullreq_created"),
            rs.getLong("pullreq_updated"));

    private final JdbcClient jdbcClient;

    public JdbcPullReqStore(JdbcClient jdbcClient) { this.jdbcClient = jdbcClient; }

    @Override
    public Optional<PullReq> findById(long id) {
        return jdbcClient.sql(FIND_BY_ID).param("id", id).query(MAPPER).optional();
    }
}
