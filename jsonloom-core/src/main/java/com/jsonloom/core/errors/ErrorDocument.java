package com.jsonloom.core.errors;

import java.util.List;

/** Top-level {@code {"errors": [...]}} response body. */
public record ErrorDocument(List<ErrorObject> errors) {

    public ErrorDocument {
        errors = List.copyOf(errors);
    }

    /**
     * The HTTP status for the whole document: the single status when all errors agree, otherwise
     * the generic status of the most severe class (500 or 400).
     */
    public int getErrorStatus() {
        if (errors.isEmpty()) {
            return 500;
        }
        int first = errors.get(0).getStatusCode();
        if (errors.stream().allMatch(e -> e.getStatusCode() == first)) {
            return first;
        }
        return errors.stream().anyMatch(e -> e.getStatusCode() >= 500) ? 500 : 400;
    }
}
