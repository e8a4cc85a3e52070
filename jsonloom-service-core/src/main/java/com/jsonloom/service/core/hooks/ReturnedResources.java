package com.jsonloom.service.core.hooks;

import com.jsonloom.core.resources.Identifiable;
import com.jsonloom.core.resources.ResourceIdentity;
import java.util.List;
import java.util.Set;

/**
 * Outcome of {@code onReturn}: the primary resources that remain visible, and every resource the
 * hooks filtered out. Fetched instances are left as they are; hidden resources must be skipped when
 * writing relationships and {@code included}.
 *
 * @param resources visible primary resources, in fetch order
 * @param hidden identities of filtered resources of any type
 */
public record ReturnedResources<T extends Identifiable<?>>(List<T> resources, Set<ResourceIdentity> hidden) {

    public ReturnedResources {
        resources = List.copyOf(resources);
        hidden = Set.copyOf(hidden);
    }

    public static <T extends Identifiable<?>> ReturnedResources<T> of(List<T> resources) {
        return new ReturnedResources<>(resources, Set.of());
    }

    public boolean isHidden(Identifiable<?> resource) {
        return resource != null && !hidden.isEmpty() && hidden.contains(ResourceIdentity.of(resource));
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }
}
