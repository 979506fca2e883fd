package dev.refhook.store.jdbc;

import dev.refhook.domain.entity.Repository;
import dev.refhook.store.RepositoryStore;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.Optional;

@org.springframework.stereotype.Repository
public class JdbcRepositoryStore implements RepositoryStore {

    private static final String FIND_BY_ID = """
            SELECT repo_id, repo_parent_id, repo_uid, repo_path, repo_git_uid,
                   repo_default_branch, repo_is_public, repo_created, repo_updated
            FROM repositories
            WHERE repo_id = :id
            """;

    private static final RowMapper<Repository> MAPPER = (rs, rowNum) -> new Repository(
            rs.getLong("repo_id"),
            rs.getLong("repo_parent_id"),
            rs.getString("repo_uid"),
            rs.getString("repo_path"),
            rs.getString("repo_git_uid"),
            rs.getString("repo_default_branch"),
            rs.getBoolean("repo_is_public"),
            rs.getLong("repo_created"),
            rs.getLong("repo_updated"));

    private final JdbcClient jdbcClient;

    public JdbcRepositoryStore(JdbcClient jdbcClient) { this.jdbcClient = jdbcClient; }

    @Override
    public Optional<Repository> findById(long id) {
        return jdbcClient.sql(FIND_BY_ID).param("id", id).query(MAPPER).optional();
    }
}
