package com.gnovoa.matchsim.core;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** The match cannot start: malformed tactics or unknown teams. Raised before kickoff only. */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class MatchSetupException extends RuntimeException {

    public MatchSetupException(String message) {
        super(message);
    }
}
