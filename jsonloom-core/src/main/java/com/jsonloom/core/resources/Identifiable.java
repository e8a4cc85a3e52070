package com.jsonloom.core.resources;

/**
 * A resource exposed through the API. The server-assigned identifier is typed; the local ID is a
 * client-chosen placeholder that is only meaningful within one atomic-operations request.
 *
 * @param <ID> identifier type
 */
public interface Identifiable<ID> {

    ID getId();

    void setId(ID id);

    String getLocalId();

    void setLocalId(String localId);
}
