package com.steward.access.grant;

import com.steward.access.Privilege;

/**
 * Selection criteria over one grant relation. Unset ({@code null}) criteria match everything.
 *
 * <p>Built fluently: {@code GrantFilter.of(USER_RESOURCE).object(id).privilege(OWNER)}.
 *
 * @param relation relation to search (required)
 * @param subjectId exact subject
 * @param objectId exact object
 * @param grantorId exact grantor
 * @param privilege exact privilege
 * @param atLeast privilege equal to or stronger than this
 * @param weakerThan privilege strictly weaker than this
 * @param excludedSubjectId any subject except this one
 */
public record GrantFilter(
        GrantRelation relation,
        String subjectId,
        String objectId,
        String grantorId,
        Privilege privilege,
        Privilege atLeast,
        Privilege weakerThan,
        String excludedSubjectId) {

    public GrantFilter {
        if (relation == null) {
            throw new IllegalArgumentException("relation must not be null");
        }
    }

    public static GrantFilter of(GrantRelation relation) {
        return new GrantFilter(relation, null, null, null, null, null, null, null);
    }

    public GrantFilter subject(String subjectId) {
        return new GrantFilter(
                relation, subjectId, objectId, grantorId, privilege, atLeast, weakerThan,
                excludedSubjectId);
    }

    public GrantFilter object(String objectId) {
        return new GrantFilter(
                relation, subjectId, objectId, grantorId, privilege, atLeast, weakerThan,
                excludedSubjectId);
    }

    public GrantFilter grantor(String grantorId) {
        return new GrantFilter(
                relation, subjectId, objectId, grantorId, privilege, atLeast, weakerThan,
                excludedSubjectId);
    }

    public GrantFilter privilege(Privilege privilege) {
        return new GrantFilter(
                relation, subjectId, objectId, grantorId, privilege, atLeast, weakerThan,
                excludedSubjectId);
    }

    public GrantFilter atLeast(Privilege atLeast) {
        return new GrantFilter(
                relation, subjectId, objectId, grantorId, privilege, atLeast, weakerThan,
                excludedSubjectId);
    }

    public GrantFilter weakerThan(Privilege weakerThan) {
        return new GrantFilter(
                relation, subjectId, objectId, grantorId, privilege, atLeast, weakerThan,
                excludedSubjectId);
    }

    public GrantFilter excludingSubject(String excludedSubjectId) {
        return new GrantFilter(
                relation, subjectId, objectId, grantorId, privilege, atLeast, weakerThan,
                excludedSubjectId);
    }

    /** Evaluates this filter against a grant; stores that filter in memory use this directly. */
    public boolean matches(Grant grant) {
        return grant.relation() == relation
                && (subjectId == null || subjectId.equals(grant.subjectId()))
                && (objectId == null || objectId.equals(grant.objectId()))
                && (grantorId == null || grantorId.equals(grant.grantorId()))
                && (privilege == null || privilege == grant.privilege())
                && (atLeast == null || grant.privilege().isAtLeast(atLeast))
                && (weakerThan == null || grant.privilege().isWeakerThan(weakerThan))
                && (excludedSubjectId == null || !excludedSubjectId.equals(grant.subjectId()));
    }
}
