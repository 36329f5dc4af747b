package com.steward.access;

/**
 * An opaque shared resource, identified by id. Only its access-relevant state lives here.
 *
 * @param id unique resource identifier
 * @param title display title
 * @param flags current state flags
 */
public record AccessResource(String id, String title, ResourceFlags flags) {

    public AccessResource {
        if (id == null || id.isBlank()) {
            throw new AccessUsageException("resource id must not be null or blank");
        }
        if (flags == null) {
            flags = ResourceFlags.defaults();
        }
    }

    public boolean active() {
        return flags.active();
    }

    public AccessResource withFlags(ResourceFlags flags) {
        return new AccessResource(id, title, flags);
    }
}
