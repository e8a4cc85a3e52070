package com.jsonloom.core.errors;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/**
 * One entry of the {@code errors} array in a JSON:API error document. The status is held as an
 * int and written as a string.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "status", "title", "detail", "source", "links", "meta"})
public class ErrorObject {
    private String id = UUID.randomUUID().toString();

    @JsonIgnore
    private int statusCode;

    private String title;
    private String detail;
    private ErrorSource source;
    private ErrorLinks links;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> meta = new LinkedHashMap<>();

    public ErrorObject(int statusCode) {
        this.statusCode = statusCode;
    }

    public ErrorObject(int statusCode, String title, String detail) {
        this(statusCode);
        this.title = title;
        this.detail = detail;
    }

    @JsonProperty("status")
    public String getStatus() {
        return String.valueOf(statusCode);
    }

    /** Prepends a prefix to the source pointer, creating the source when absent. */
    public void prependPointer(String prefix) {
        String pointer = source != null && source.pointer() != null ? source.pointer() : "";
        source = new ErrorSource(prefix + pointer, source != null ? source.parameter() : null);
    }

    @Override
    public String toString() {
        return statusCode + " " + title + (detail != null ? ": " + detail : "");
    }
}
