package com.gt.dailyprep.exception;

// Stored data is missing or not in the shape the application expects
public class DaoException extends RuntimeException {

    public DaoException(String errMsg)  {
        super(errMsg);
    }

    public DaoException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
