package com.jsonloom.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AtomicReference {

    @NotBlank
    private String type;

    private String id;

    private String lid;

    private String relationship;
}
