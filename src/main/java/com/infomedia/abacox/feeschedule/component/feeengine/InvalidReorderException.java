package com.infomedia.abacox.feeschedule.component.feeengine;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidReorderException extends FeeEngineException {

    public InvalidReorderException(String message) {
        super(message);
    }
}
