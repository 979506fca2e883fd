package dev.refhook.store.jdbc;

import dev.refhook.domain.entity.Principal;
import dev.refhook.domain.enums.PrincipalType;
import dev.refhook.store.PrincipalStore;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JdbcPrincipalStore implements PrincipalStore {

    private static final String FIND_BY_ID = """
            SELECT principal_id, principal_uid, principal_email, principal_display_name,
                   principal_type, principal_admin, principal_created, principal_updated
            FROM principals
            WHERE principal_id = :id
            """;

    private static final RowMapper<Principal> MAPPER = (rs, rowNum) -> new Principal(
            rs.getLong("principal_id"),
            rs.getString("principal_uid"),
            rs.getString("principal_email"),
            rs.getString("principal_display_name"),
            PrincipalType.fromValue(rs.getString("principal_type")),
            rs.getBoolean("principal_admin"),
            rs.getLong("principal_created"),
            rs.getLong("principal_updated"));

    private final JdbcClient jdbcClient;

    public JdbcPrincipalStore(JdbcClient jdbcClient) { this.jdbcClient = jdbcClient; }

    @Override
    public Optional<Principal> findById(long id) {
        return jdbcClient.sql(FIND_BY_ID).param("id", id).query(MAPPER).optional();
    }
}
