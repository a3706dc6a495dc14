package com.gnovoa.matchsim.core;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** A manual substitution broke a match rule. The match state is left untouched. */
@ResponseStatus(HttpStatus.CONFLICT)
public class SubstitutionRejectedException extends RuntimeException {

    public SubstitutionRejectedException(String message) {
        super(message);
    }
}
