package com.infomedia.abacox.feeschedule.service.common;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The client wrote against an outdated snapshot. It should re-fetch and discard its optimistic value.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class StaleWriteException extends RuntimeException {

    public StaleWriteException(String message) {
        super(message);
    }

    public StaleWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
