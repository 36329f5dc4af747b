package com.steward.access.mutate;

import com.steward.access.grant.Grant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one line per grant change to the {@value #AUDIT_LOGGER} logger.
 *
 * <p>Lines share a {@code GRANT_CHANGE} prefix followed by {@code key=value} pairs so they can be
 * routed to a separate appender and parsed without a schema.
 */
public class GrantAuditLogger {

    public static final String AUDIT_LOGGER = "com.steward.access.audit";

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger(AUDIT_LOGGER);

    /** A grant was created. */
    public void logGrant(String actorUserId, Grant grant) {
        AUDIT_LOG.info(
                "GRANT_CHANGE actor={} action=grant relation={} subject={} object={} privilege={}",
                actorUserId,
                grant.relation().label(),
                grant.subjectId(),
                grant.objectId(),
                grant.privilege());
    }

    /** An existing grant changed level. */
    public void logRegrant(String actorUserId, Grant before, Grant after) {
        AUDIT_LOG.info(
                "GRANT_CHANGE actor={} action=regrant relation={} subject={} object={} privilege={}"
                        + " fromPrivilege={}",
                actorUserId,
                after.relation().label(),
                after.subjectId(),
                after.objectId(),
                after.privilege(),
                before.privilege());
    }

    /**
     * A grant was removed.
     *
     * @param action {@code unshare}, {@code undo}, {@code override} or {@code delete}
     */
    public void logRevoke(String actorUserId, String action, Grant grant) {
        AUDIT_LOG.info(
                "GRANT_CHANGE actor={} action={} relation={} subject={} object={} privilege={}"
                        + " grantor={}",
                actorUserId,
                action,
                grant.relation().label(),
                grant.subjectId(),
                grant.objectId(),
                grant.privilege(),
                grant.grantorId());
    }
}
