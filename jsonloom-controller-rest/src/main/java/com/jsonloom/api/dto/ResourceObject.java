package com.jsonloom.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "id", "lid", "attributes", "relationships"})
@Data
public class ResourceObject {

    private String type;

    private String id;

    private String lid;

    /** Attribute values; null values are kept unless the serializer options omit them. */
    @JsonInclude(value = JsonInclude.Include.NON_EMPTY, content = JsonInclude.Include.ALWAYS)
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, RelationshipObject> relationships = new LinkedHashMap<>();
}
