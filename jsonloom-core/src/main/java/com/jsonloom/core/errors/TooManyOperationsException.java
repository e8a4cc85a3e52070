package com.jsonloom.core.errors;

public class TooManyOperationsException extends JsonApiException {

    public TooManyOperationsException(int maximumOperationsPerRequest) {
        super(build(maximumOperationsPerRequest));
    }

    private static ErrorObject build(int maximum) {
        ErrorObject error = new ErrorObject(
                413,
                "Too many operations in request.",
                "The number of operations in this request exceeds the maximum of " + maximum + ".");
        error.setSource(ErrorSource.forPointer("/atomic:operations"));
        return error;
    }
}
