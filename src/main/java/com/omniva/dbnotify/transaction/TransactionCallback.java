package com.omniva.dbnotify.transaction;

@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction(TransactionHandle tx) throws Exception;
}
