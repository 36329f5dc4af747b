package com.steward.access;

/** Why an access rule refused a request. */
public enum DenialReason {
    INACTIVE_REQUESTER("requesting user is not active"),
    INACTIVE_GRANTEE("grantee is not active"),
    INACTIVE_OBJECT("group or resource is not active"),
    IMMUTABLE("resource is immutable"),
    NOT_OWNER("requesting user must be owner or superuser"),
    NOT_SHAREABLE("requesting user is not owner and object is not shareable"),
    NO_PRIVILEGE("requesting user has no privilege over object"),
    INSUFFICIENT_PRIVILEGE("requesting user has insufficient privilege over object"),
    NOT_A_MEMBER("requesting user is not a member of the group"),
    INSUFFICIENT_UNSHARE_PRIVILEGE("requesting user has insufficient privilege to unshare"),
    SOLE_OWNER("cannot remove or demote the sole owner"),
    NOTHING_TO_UNDO("no share to undo");

    private final String description;

    DenialReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
