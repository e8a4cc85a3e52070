package com.jsonloom.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Relationship value: a single {@link ResourceIdentifierObject}, a list of them, or null for an
 * empty to-one relationship.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipObject {

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Object data;
}
