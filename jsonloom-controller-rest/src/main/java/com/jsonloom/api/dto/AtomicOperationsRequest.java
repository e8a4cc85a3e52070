package com.jsonloom.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.Data;

/** Body of {@code POST /operations}. */
@Data
public class AtomicOperationsRequest {

    @JsonProperty("atomic:operations")
    @NotEmpty
    @Valid
    private List<AtomicOperationObject> operations;
}
