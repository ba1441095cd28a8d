package com.gt.dailyprep.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// No pool has an eligible problem left to hand out
@ResponseStatus(value = HttpStatus.CONFLICT)
public class SelectionExhaustedException extends RuntimeException {

    public SelectionExhaustedException(String msg) {
        super(msg);
    }
}
