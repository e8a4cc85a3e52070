package com.jsonloom.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/** Top-level response document of the read endpoints. */
@JsonPropertyOrder({"data", "included"})
@Data
public class Document {

    /** Resource object, list of resource objects, resource identifier(s) or null. */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Object data;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<ResourceObject> included = new ArrayList<>();
}
