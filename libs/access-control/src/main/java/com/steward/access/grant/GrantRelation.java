package com.steward.access.grant;

/**
 * The three independently keyed grant relations.
 *
 * <p>Subjects and objects are identified by id; the relation tells which kind of principal each id
 * names.
 */
public enum GrantRelation {

    /** A user's privilege over (membership in) a group. */
    USER_GROUP(PrincipalKind.USER, PrincipalKind.GROUP),

    /** A user's direct privilege over a resource. */
    USER_RESOURCE(PrincipalKind.USER, PrincipalKind.RESOURCE),

    /** A group's privilege over a resource, conferred on each active member. */
    GROUP_RESOURCE(PrincipalKind.GROUP, PrincipalKind.RESOURCE);

    /** Kind of entity on either side of a relation. */
    public enum PrincipalKind {
        USER,
        GROUP,
        RESOURCE
    }

    private final PrincipalKind subjectKind;
    private final PrincipalKind objectKind;

    GrantRelation(PrincipalKind subjectKind, PrincipalKind objectKind) {
        this.subjectKind = subjectKind;
        this.objectKind = objectKind;
    }

    public PrincipalKind subjectKind() {
        return subjectKind;
    }

    public PrincipalKind objectKind() {
        return objectKind;
    }

    /** Lower-case label used in logs and metrics, e.g. {@code user_group}. */
    public String label() {
        return name().toLowerCase();
    }
}
