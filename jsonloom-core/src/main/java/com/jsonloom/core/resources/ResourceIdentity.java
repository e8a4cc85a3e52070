package com.jsonloom.core.resources;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Equality key for resource instances: same class and same identifier (or same local ID when no
 * identifier is known yet). Instances carrying neither are only equal to themselves.
 */
public record ResourceIdentity(Class<?> type, String stringId, String localId, Object instance) {

    public static ResourceIdentity of(Identifiable<?> resource) {
        Object id = resource.getId();
        String stringId = id == null ? null : id.toString();
        String localId = resource.getLocalId();
        Object instance = stringId == null && localId == null ? new IdentityKey(resource) : null;
        return new ResourceIdentity(resource.getClass(), stringId, stringId == null ? localId : null, instance);
    }

    /** Keeps the first instance of every distinct resource, preserving encounter order. */
    public static <T extends Identifiable<?>> Set<T> distinct(Collection<? extends T> resources) {
        Map<ResourceIdentity, T> unique = new LinkedHashMap<>();
        for (T resource : resources) {
            if (resource != null) {
                unique.putIfAbsent(of(resource), resource);
            }
        }
        return new LinkedHashSet<>(unique.values());
    }

    private record IdentityKey(Object target) {
        @Override
        public boolean equals(Object other) {
            return other instanceof IdentityKey key && key.target == target;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(target);
        }
    }
}
