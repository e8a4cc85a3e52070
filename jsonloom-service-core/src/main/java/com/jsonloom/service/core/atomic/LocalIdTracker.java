package com.jsonloom.service.core.atomic;

import com.jsonloom.core.errors.IncompatibleLocalIdTypeException;
import com.jsonloom.core.errors.LocalIdAlreadyDeclaredException;
import com.jsonloom.core.errors.LocalIdNotAssignedException;
import com.jsonloom.core.errors.LocalIdNotFoundException;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps client-chosen local IDs to the resource type that declared them and, once the declaring
 * create has run, to the server-assigned ID. One instance per atomic-operations request.
 */
public class LocalIdTracker {
    private final Map<String, Item> idsTracked = new HashMap<>();

    public void reset() {
        idsTracked.clear();
    }

    public boolean isEmpty() {
        return idsTracked.isEmpty();
    }

    /**
     * @throws LocalIdAlreadyDeclaredException when the local ID is already declared
     */
    public void declare(String localId, String resourceType) {
        if (idsTracked.containsKey(localId)) {
            throw new LocalIdAlreadyDeclaredException(localId);
        }
        idsTracked.put(localId, new Item(resourceType));
    }

    /**
     * @throws IllegalStateException when a server ID was already assigned
     */
    public void assign(String localId, String resourceType, String stringId) {
        Item item = getDeclared(localId);
        assertSameResourceType(resourceType, item.resourceType, localId);
        if (item.serverId != null) {
            throw new IllegalStateException("Cannot reassign to existing local ID '" + localId + "'.");
        }
        item.serverId = stringId;
    }

    /** Returns the server-assigned ID for a declared and assigned local ID. */
    public String getValue(String localId, String resourceType) {
        Item item = getDeclared(localId);
        assertSameResourceType(resourceType, item.resourceType, localId);
        if (item.serverId == null) {
            throw new LocalIdNotAssignedException(localId);
        }
        return item.serverId;
    }

    private Item getDeclared(String localId) {
        Item item = idsTracked.get(localId);
        if (item == null) {
            throw new LocalIdNotFoundException(localId);
        }
        return item;
    }

    private static void assertSameResourceType(String currentType, String declaredType, String localId) {
        if (!declaredType.equals(currentType)) {
            throw new IncompatibleLocalIdTypeException(localId, declaredType, currentType);
        }
    }

    private static final class Item {
        private final String resourceType;
        private String serverId;

        private Item(String resourceType) {
            this.resourceType = resourceType;
        }
    }
}
