package com.steward.database.jdbc;

import com.steward.access.AccessGroup;
import com.steward.access.AccessResource;
import com.steward.access.AccessUsageException;
import com.steward.access.AccessUser;
import com.steward.access.GroupFlags;
import com.steward.access.ResourceFlags;
import com.steward.access.store.EntityStore;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/** {@link EntityStore} over {@code access_user}, {@code access_group} and {@code access_resource}. */
public class JdbcEntityStore implements EntityStore {

    private static final RowMapper<AccessUser> USER =
            (rs, rowNum) ->
                    new AccessUser(
                            rs.getString("id"),
                            rs.getBoolean("is_active"),
                            rs.getBoolean("is_superuser"));

    private static final RowMapper<AccessGroup> GROUP =
            (rs, rowNum) ->
                    new AccessGroup(
                            rs.getString("id"),
                            rs.getString("name"),
                            new GroupFlags(
                                    rs.getBoolean("is_active"),
                                    rs.getBoolean("is_discoverable"),
                                    rs.getBoolean("is_public"),
                                    rs.getBoolean("is_shareable")));

    private static final RowMapper<AccessResource> RESOURCE =
            (rs, rowNum) ->
                    new AccessResource(
                            rs.getString("id"),
                            rs.getString("title"),
                            new ResourceFlags(
                                    rs.getBoolean("is_active"),
                                    rs.getBoolean("is_discoverable"),
                                    rs.getBoolean("is_public"),
                                    rs.getBoolean("is_shareable"),
                                    rs.getBoolean("is_published"),
                                    rs.getBoolean("is_immutable")));

    private final JdbcTemplate jdbc;

    public JdbcEntityStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    // ── Users ──

    @Override
    public Optional<AccessUser> findUser(String userId) {
        return first(jdbc.query("SELECT * FROM access_user WHERE id = ?", USER, userId));
    }

    @Override
    public AccessUser saveUser(AccessUser user) {
        int updated =
                jdbc.update(
                        "UPDATE access_user SET is_active = ?, is_superuser = ? WHERE id = ?",
                        user.active(),
                        user.superuser(),
                        user.id());
        if (updated == 0) {
            jdbc.update(
                    "INSERT INTO access_user (id, is_active, is_superuser) VALUES (?, ?, ?)",
                    user.id(),
                    user.active(),
                    user.superuser());
        }
        return user;
    }

    // ── Groups ──

    @Override
    public Optional<AccessGroup> findGroup(String groupId) {
        return first(jdbc.query("SELECT * FROM access_group WHERE id = ?", GROUP, groupId));
    }

    @Override
    public AccessGroup insertGroup(String name, GroupFlags flags) {
        AccessGroup group = new AccessGroup(newId(), name, flags);
        jdbc.update(
                "INSERT INTO access_group"
                        + " (id, name, is_active, is_discoverable, is_public, is_shareable)"
                        + " VALUES (?, ?, ?, ?, ?, ?)",
                group.id(),
                name,
                flags.active(),
                flags.discoverable(),
                flags.isPublic(),
                flags.shareable());
        return group;
    }

    @Override
    public AccessGroup updateGroupFlags(String groupId, GroupFlags flags) {
        int updated =
                jdbc.update(
                        "UPDATE access_group"
                                + " SET is_active = ?, is_discoverable = ?, is_public = ?, is_shareable = ?"
                                + " WHERE id = ?",
                        flags.active(),
                        flags.discoverable(),
                        flags.isPublic(),
                        flags.shareable(),
                        groupId);
        if (updated == 0) {
            throw new AccessUsageException("Unknown group: " + groupId);
        }
        return findGroup(groupId).orElseThrow();
    }

    @Override
    public void deleteGroup(String groupId) {
        jdbc.update("DELETE FROM access_group WHERE id = ?", groupId);
    }

    // ── Resources ──

    @Override
    public Optional<AccessResource> findResource(String resourceId) {
        return first(jdbc.query("SELECT * FROM access_resource WHERE id = ?", RESOURCE, resourceId));
    }

    @Override
    public AccessResource insertResource(String title, ResourceFlags flags) {
        AccessResource resource = new AccessResource(newId(), title, flags);
        jdbc.update(
                "INSERT INTO access_resource (id, title, is_active, is_discoverable, is_public,"
                        + " is_shareable, is_published, is_immutable)"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                resource.id(),
                title,
                flags.active(),
                flags.discoverable(),
                flags.isPublic(),
                flags.shareable(),
                flags.published(),
                flags.immutable());
        return resource;
    }

    @Override
    public AccessResource updateResourceFlags(String resourceId, ResourceFlags flags) {
        int updated =
                jdbc.update(
                        "UPDATE access_resource SET is_active = ?, is_discoverable = ?, is_public = ?,"
                                + " is_shareable = ?, is_published = ?, is_immutable = ?"
                                + " WHERE id = ?",
                        flags.active(),
                        flags.discoverable(),
                        flags.isPublic(),
                        flags.shareable(),
                        flags.published(),
                        flags.immutable(),
                        resourceId);
        if (updated == 0) {
            throw new AccessUsageException("Unknown resource: " + resourceId);
        }
        return findResource(resourceId).orElseThrow();
    }

    @Override
    public void deleteResource(String resourceId) {
        jdbc.update("DELETE FROM access_resource WHERE id = ?", resourceId);
    }

    // ── Private Helpers ──

    private static <T> Optional<T> first(List<T> rows) {
        return rows.stream().findFirst();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
