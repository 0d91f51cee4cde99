package com.stakeledger.web;

import org.springframework.http.HttpStatus;

public class LedgerAuthorizationException extends LedgerException {

    public LedgerAuthorizationException(String message) {
        super(HttpStatus.FORBIDDEN, "not_authorized", message);
    }
}
