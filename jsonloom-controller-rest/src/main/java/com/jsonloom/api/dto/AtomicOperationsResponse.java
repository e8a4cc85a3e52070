package com.jsonloom.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AtomicOperationsResponse {

    @JsonProperty("atomic:results")
    private List<AtomicResultObject> results;
}
