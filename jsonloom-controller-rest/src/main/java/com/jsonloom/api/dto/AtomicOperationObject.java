package com.jsonloom.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AtomicOperationObject {

    /** One of {@code add}, {@code update} or {@code remove}. */
    @NotBlank
    private String op;

    @Valid
    private AtomicReference ref;

    /** Not supported; operations must target resources through {@code ref} or {@code data}. */
    private String href;

    /**
     * Resource object, resource identifier(s) or null. Absent is Java null; an explicit JSON null
     * arrives as a {@code NullNode}.
     */
    private JsonNode data;
}
