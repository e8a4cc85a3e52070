package com.jsonloom.core.resources;

import com.jsonloom.core.resources.annotations.AttrCapabilities;
import java.lang.reflect.Field;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public final class AttrAttribute extends ResourceFieldAttribute {
    private final Set<AttrCapabilities> capabilities;

    public AttrAttribute(String publicName, Field property, Set<AttrCapabilities> capabilities) {
        super(publicName, property);
        this.capabilities = capabilities.isEmpty()
                ? EnumSet.noneOf(AttrCapabilities.class)
                : EnumSet.copyOf(capabilities);
    }

    public boolean hasCapability(AttrCapabilities capability) {
        return capabilities.contains(capability);
    }

    public Set<AttrCapabilities> getCapabilities() {
        return Collections.unmodifiableSet(capabilities);
    }
}
