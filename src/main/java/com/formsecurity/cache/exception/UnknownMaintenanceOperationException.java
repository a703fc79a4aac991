package com.formsecurity.cache.exception;

/**
 * 未知的维护操作名
 */
public class UnknownMaintenanceOperationException extends CacheException {

    public UnknownMaintenanceOperationException(String operation) {
        super("Unknown maintenance operation: " + operation);
    }
}
