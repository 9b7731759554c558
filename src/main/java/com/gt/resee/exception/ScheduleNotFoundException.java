package com.gt.resee.exception;

// Thrown when a review is submitted for a pair with no active schedule. Not retryable
public class ScheduleNotFoundException extends RuntimeException {

    public ScheduleNotFoundException(String errMsg)  {
        super(errMsg);
    }

    public ScheduleNotFoundException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
