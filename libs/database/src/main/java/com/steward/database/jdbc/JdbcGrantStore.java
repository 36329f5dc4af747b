package com.steward.database.jdbc;

import com.steward.access.AccessIntegrityException;
import com.steward.access.Privilege;
import com.steward.access.grant.Grant;
import com.steward.access.grant.GrantFilter;
import com.steward.access.grant.GrantRelation;
import com.steward.access.store.GrantStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link GrantStore} over the {@code *_grant} tables created by {@code V1__access_control_schema}.
 *
 * <p>All three relations share one column layout ({@code subject_id, object_id, grantor_id,
 * privilege, granted_at}), so a single set of statements serves every relation with only the table
 * name varying. Rows are returned in insertion order ({@code ORDER BY id}).
 *
 * <p>Runs inside whatever Spring transaction is active on the shared {@code DataSource}; use
 * {@link JdbcTransactionRunner} to open one.
 */
public class JdbcGrantStore implements GrantStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcGrantStore.class);

    private static final String COLUMNS = "subject_id, object_id, grantor_id, privilege, granted_at";

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcGrantStore(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public Optional<Grant> find(Grant.Key key) {
        List<Grant> found =
                jdbc.query(
                        "SELECT " + COLUMNS + " FROM " + table(key.relation())
                                + " WHERE subject_id = ? AND object_id = ? AND grantor_id = ?",
                        mapper(key.relation()),
                        key.subjectId(),
                        key.objectId(),
                        key.grantorId());
        return found.stream().findFirst();
    }

    @Override
    public List<Grant> findAll(GrantFilter filter) {
        Where where = Where.of(filter);
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM " + table(filter.relation()) + where.sql()
                        + " ORDER BY id",
                mapper(filter.relation()),
                where.args());
    }

    @Override
    public int count(GrantFilter filter) {
        Where where = Where.of(filter);
        Integer count =
                jdbc.queryForObject(
                        "SELECT COUNT(*) FROM " + table(filter.relation()) + where.sql(),
                        Integer.class,
                        where.args());
        return count == null ? 0 : count;
    }

    @Override
    public boolean exists(GrantFilter filter) {
        return count(filter) > 0;
    }

    @Override
    public Grant insert(Grant grant) {
        try {
            jdbc.update(
                    "INSERT INTO " + table(grant.relation()) + " (" + COLUMNS + ")"
                            + " VALUES (?, ?, ?, ?, ?)",
                    grant.subjectId(),
                    grant.objectId(),
                    grant.grantorId(),
                    grant.privilege().code(),
                    toTimestamp(grant.grantedAt()));
        } catch (DuplicateKeyException e) {
            throw new AccessIntegrityException("Duplicate grant: " + grant.key(), e);
        }
        return grant;
    }

    @Override
    public Grant updatePrivilege(Grant.Key key, Privilege privilege) {
        Privilege.requireGrantable(privilege);
        int updated =
                jdbc.update(
                        "UPDATE " + table(key.relation())
                                + " SET privilege = ?, granted_at = ?"
                                + " WHERE subject_id = ? AND object_id = ? AND grantor_id = ?",
                        privilege.code(),
                        toTimestamp(clock.instant()),
                        key.subjectId(),
                        key.objectId(),
                        key.grantorId());
        if (updated == 0) {
            throw new AccessIntegrityException("No grant to update: " + key);
        }
        return find(key).orElseThrow(() -> new AccessIntegrityException("Grant vanished: " + key));
    }

    @Override
    public int delete(GrantFilter filter) {
        Where where = Where.of(filter);
        int deleted = jdbc.update("DELETE FROM " + table(filter.relation()) + where.sql(), where.args());
        log.debug("Deleted {} {} grants", deleted, filter.relation().label());
        return deleted;
    }

    @Override
    public void lockObject(GrantRelation relation, String objectId) {
        String objectTable =
                relation.objectKind() == GrantRelation.PrincipalKind.GROUP
                        ? "access_group"
                        : "access_resource";
        jdbc.queryForList(
                "SELECT id FROM " + objectTable + " WHERE id = ? FOR UPDATE", String.class, objectId);
    }

    // ── Private Helpers ──

    private static String table(GrantRelation relation) {
        switch (relation) {
            case USER_GROUP:
                return "user_group_grant";
            case USER_RESOURCE:
                return "user_resource_grant";
            case GROUP_RESOURCE:
                return "group_resource_grant";
            default:
                throw new IllegalArgumentException("Unknown relation: " + relation);
        }
    }

    private static RowMapper<Grant> mapper(GrantRelation relation) {
        return (ResultSet rs, int rowNum) ->
                new Grant(
                        relation,
                        rs.getString("subject_id"),
                        rs.getString("object_id"),
                        rs.getString("grantor_id"),
                        privilegeOf(rs),
                        rs.getObject("granted_at", OffsetDateTime.class).toInstant());
    }

    private static Privilege privilegeOf(ResultSet rs) throws SQLException {
        int code = rs.getInt("privilege");
        if (code < Privilege.OWNER.code() || code > Privilege.VIEW.code()) {
            throw new AccessIntegrityException("Stored grant carries privilege code " + code);
        }
        return Privilege.fromCode(code);
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    /** WHERE clause and bind arguments for a {@link GrantFilter}. */
    private record Where(String sql, Object[] args) {

        static Where of(GrantFilter filter) {
            List<String> conditions = new ArrayList<>();
            List<Object> args = new ArrayList<>();
            if (filter.subjectId() != null) {
                conditions.add("subject_id = ?");
                args.add(filter.subjectId());
            }
            if (filter.objectId() != null) {
                conditions.add("object_id = ?");
                args.add(filter.objectId());
            }
            if (filter.grantorId() != null) {
                conditions.add("grantor_id = ?");
                args.add(filter.grantorId());
            }
            if (filter.privilege() != null) {
                conditions.add("privilege = ?");
                args.add(filter.privilege().code());
            }
            if (filter.atLeast() != null) {
                conditions.add("privilege <= ?");
                args.add(filter.atLeast().code());
            }
            if (filter.weakerThan() != null) {
                conditions.add("privilege > ?");
                args.add(filter.weakerThan().code());
            }
            if (filter.excludedSubjectId() != null) {
                conditions.add("subject_id <> ?");
                args.add(filter.excludedSubjectId());
            }
            String sql = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
            return new Where(sql, args.toArray());
        }
    }
}
