package com.steward.access.grant;

import com.steward.access.AccessUsageException;
import com.steward.access.Privilege;
import java.time.Instant;

/**
 * One delegation of access: {@code grantor} gave {@code subject} a privilege over {@code object}.
 *
 * <p>A relation holds at most one grant per {@link #key()}; granting again replaces the privilege.
 *
 * @param relation which of the three relations this grant belongs to
 * @param subjectId the user or group receiving the privilege
 * @param objectId the group or resource the privilege applies to
 * @param grantorId the user who granted it
 * @param privilege OWNER, CHANGE or VIEW; never NONE
 * @param grantedAt when the grant was created or last changed
 */
public record Grant(
        GrantRelation relation,
        String subjectId,
        String objectId,
        String grantorId,
        Privilege privilege,
        Instant grantedAt) {

    public Grant {
        if (relation == null) {
            throw new AccessUsageException("relation must not be null");
        }
        requireId(subjectId, "subjectId");
        requireId(objectId, "objectId");
        requireId(grantorId, "grantorId");
        Privilege.requireGrantable(privilege);
        if (grantedAt == null) {
            throw new AccessUsageException("grantedAt must not be null");
        }
    }

    /** The unique key of this grant within its relation. */
    public Key key() {
        return new Key(relation, subjectId, objectId, grantorId);
    }

    public Grant withPrivilege(Privilege privilege, Instant grantedAt) {
        return new Grant(relation, subjectId, objectId, grantorId, privilege, grantedAt);
    }

    private static void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new AccessUsageException(field + " must not be null or blank");
        }
    }

    /**
     * Unique (subject, object, grantor) key of a grant.
     *
     * @param relation relation the key belongs to
     * @param subjectId grantee
     * @param objectId group or resource
     * @param grantorId granting user
     */
    public record Key(GrantRelation relation, String subjectId, String objectId, String grantorId) {}
}
