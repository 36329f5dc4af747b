package com.steward.access;

/**
 * Privilege a principal holds over a group or resource.
 *
 * <p>Levels are ordered by numeric code: a <em>lower</em> code is a <em>stronger</em> privilege.
 *
 * <ul>
 *   <li>{@link #OWNER} (1): owns the object; may share, unshare and change flags
 *   <li>{@link #CHANGE} (2): may change content but not state
 *   <li>{@link #VIEW} (3): may view but not change
 *   <li>{@link #NONE} (4): no privilege; a query result only, never stored in a grant
 * </ul>
 */
public enum Privilege {
    OWNER(1),
    CHANGE(2),
    VIEW(3),
    NONE(4);

    private final int code;

    Privilege(int code) {
        this.code = code;
    }

    /** The numeric code (1 = OWNER … 4 = NONE), as persisted. */
    public int code() {
        return code;
    }

    /** True if this privilege is the same as or stronger than {@code other}. */
    public boolean isAtLeast(Privilege other) {
        return code <= other.code;
    }

    /** True if this privilege is strictly stronger than {@code other}. */
    public boolean isStrongerThan(Privilege other) {
        return code < other.code;
    }

    /** True if this privilege is strictly weaker than {@code other}. */
    public boolean isWeakerThan(Privilege other) {
        return code > other.code;
    }

    /** Whether a grant may carry this privilege. Only {@link #NONE} is not grantable. */
    public boolean isGrantable() {
        return this != NONE;
    }

    /** The stronger of two privileges (numeric minimum). */
    public static Privilege strongest(Privilege a, Privilege b) {
        return a.code <= b.code ? a : b;
    }

    /** The weaker of two privileges (numeric maximum). */
    public static Privilege weakest(Privilege a, Privilege b) {
        return a.code >= b.code ? a : b;
    }

    /**
     * Looks up a privilege by its numeric code.
     *
     * @throws AccessUsageException if the code is outside 1..4
     */
    public static Privilege fromCode(int code) {
        for (Privilege privilege : values()) {
            if (privilege.code == code) {
                return privilege;
            }
        }
        throw new AccessUsageException("Unknown privilege code: " + code);
    }

    /**
     * Validates that {@code privilege} may be stored in a grant.
     *
     * @throws AccessUsageException if the privilege is null or {@link #NONE}
     */
    public static Privilege requireGrantable(Privilege privilege) {
        if (privilege == null || !privilege.isGrantable()) {
            throw new AccessUsageException("Privilege level not valid for a grant: " + privilege);
        }
        return privilege;
    }
}
