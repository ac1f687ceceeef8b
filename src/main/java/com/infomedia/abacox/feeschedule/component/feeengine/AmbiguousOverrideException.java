package com.infomedia.abacox.feeschedule.component.feeengine;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * An override that is bound to both scopes, to neither, or that duplicates another override
 * on the same (scope, fee rule) key. Always a data integrity problem upstream.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class AmbiguousOverrideException extends FeeEngineException {

    public AmbiguousOverrideException(String message) {
        super(message);
    }
}
