package com.gt.dailyprep.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class ProblemNotFoundException extends RuntimeException {

    public ProblemNotFoundException(String msg) {
        super(msg);
    }
}
