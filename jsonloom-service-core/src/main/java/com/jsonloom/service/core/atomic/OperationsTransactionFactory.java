package com.jsonloom.service.core.atomic;

public interface OperationsTransactionFactory {

    OperationsTransaction beginTransaction();
}
