package com.infomedia.abacox.feeschedule.component.feeengine;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when fee configuration values violate the engine's numeric or structural constraints
 * (negative amounts, non-positive multipliers, empty waiver code sets, CAA flag without a CAA amount).
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidFeeConfigurationException extends FeeEngineException {

    public InvalidFeeConfigurationException(String message) {
        super(message);
    }

    public InvalidFeeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
