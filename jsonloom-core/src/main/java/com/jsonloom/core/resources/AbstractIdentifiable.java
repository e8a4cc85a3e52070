package com.jsonloom.core.resources;

import lombok.Getter;
import lombok.Setter;

/** Convenience base class holding the identifier and local ID. */
@Getter
@Setter
public abstract class AbstractIdentifiable<ID> implements Identifiable<ID> {
    private ID id;
    private String localId;

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + (localId != null ? ", lid=" + localId : "") + "}";
    }
}
