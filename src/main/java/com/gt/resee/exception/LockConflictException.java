package com.gt.resee.exception;

// Thrown when a schedule lock could not be acquired within the configured attempts. Callers may retry
public class LockConflictException extends RuntimeException {

    public LockConflictException(String errMsg)  {
        super(errMsg);
    }

    public LockConflictException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
