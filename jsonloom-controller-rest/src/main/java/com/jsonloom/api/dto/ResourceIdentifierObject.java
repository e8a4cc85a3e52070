package com.jsonloom.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "id", "lid"})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceIdentifierObject {

    private String type;

    private String id;

    private String lid;
}
