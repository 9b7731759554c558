package com.gt.resee.exception;

public class ReviewHistoryNotFoundException extends RuntimeException {

    public ReviewHistoryNotFoundException(String errMsg)  {
        super(errMsg);
    }

    public ReviewHistoryNotFoundException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
