package com.steward.access;

/**
 * State flags of a resource.
 *
 * @param active whether the resource is in use
 * @param discoverable whether resource metadata is visible to everyone
 * @param isPublic whether resource data is viewable by everyone
 * @param shareable whether holders who are not owners may share the resource
 * @param published whether the resource has been published
 * @param immutable prevents every change, including by owners
 */
public record ResourceFlags(
        boolean active,
        boolean discoverable,
        boolean isPublic,
        boolean shareable,
        boolean published,
        boolean immutable) {

    /** Flags of a newly created resource: active and shareable, nothing else. */
    public static ResourceFlags defaults() {
        return new ResourceFlags(true, false, false, true, false, false);
    }

    public ResourceFlags withActive(boolean active) {
        return new ResourceFlags(active, discoverable, isPublic, shareable, published, immutable);
    }

    public ResourceFlags withDiscoverable(boolean discoverable) {
        return new ResourceFlags(active, discoverable, isPublic, shareable, published, immutable);
    }

    public ResourceFlags withPublic(boolean isPublic) {
        return new ResourceFlags(active, discoverable, isPublic, shareable, published, immutable);
    }

    public ResourceFlags withShareable(boolean shareable) {
        return new ResourceFlags(active, discoverable, isPublic, shareable, published, immutable);
    }

    public ResourceFlags withPublished(boolean published) {
        return new ResourceFlags(active, discoverable, isPublic, shareable, published, immutable);
    }

    public ResourceFlags withImmutable(boolean immutable) {
        return new ResourceFlags(active, discoverable, isPublic, shareable, published, immutable);
    }
}
