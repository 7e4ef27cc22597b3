package com.example.catalogsync.exception;

/**
 * Transport or protocol failure while talking to the catalog or to a source system.
 */
public class RemoteException extends CatalogSyncException {

    private final int statusCode;
    private final String operation;

    public RemoteException(String message, String operation) {
        super(message);
        this.statusCode = 500;
        this.operation = operation;
    }

    public RemoteException(String message, String operation, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
        this.operation = operation;
    }

    public RemoteException(String message, int statusCode, String operation) {
        super(message);
        this.statusCode = statusCode;
        this.operation = operation;
    }

    public RemoteException(String message, int statusCode, String operation, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.operation = operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getOperation() {
        return operation;
    }
}
