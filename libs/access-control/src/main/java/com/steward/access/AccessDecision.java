package com.steward.access;

/**
 * Outcome of evaluating one access rule.
 *
 * <p>Predicates report {@link #allowed()}; actions call {@link #enforce()}. Both come from the same
 * evaluation, so the two can never disagree.
 *
 * @param allowed whether the request is permitted
 * @param reason why it was refused ({@code null} when allowed)
 */
public record AccessDecision(boolean allowed, DenialReason reason) {

    private static final AccessDecision ALLOW = new AccessDecision(true, null);

    public AccessDecision {
        if (!allowed && reason == null) {
            throw new IllegalArgumentException("a denial must carry a reason");
        }
        if (allowed && reason != null) {
            throw new IllegalArgumentException("an allowed decision carries no reason");
        }
    }

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision deny(DenialReason reason) {
        return new AccessDecision(false, reason);
    }

    /** Allows when {@code condition} holds, otherwise denies with {@code reason}. */
    public static AccessDecision allowIf(boolean condition, DenialReason reason) {
        return condition ? ALLOW : deny(reason);
    }

    public boolean denied() {
        return !allowed;
    }

    /**
     * Throws if this decision is a denial.
     *
     * @throws AccessDeniedException carrying {@link #reason()}
     */
    public void enforce() {
        if (!allowed) {
            throw new AccessDeniedException(reason);
        }
    }
}
