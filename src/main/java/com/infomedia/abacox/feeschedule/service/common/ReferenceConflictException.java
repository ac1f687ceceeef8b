package com.infomedia.abacox.feeschedule.service.common;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A write that would break a reference or uniqueness rule, e.g. deleting a fee rule that overrides still point to.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ReferenceConflictException extends RuntimeException {

    public ReferenceConflictException(String message) {
        super(message);
    }
}
