package com.infomedia.abacox.feeschedule.dto.feeruleoverride;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.openapitools.jackson.nullable.JsonNullable;

import java.math.BigDecimal;

/**
 * Creates or updates the override of one fee rule for one scope. Exactly one of
 * {@code classificationId} and {@code aircraftTypeId} must be set.
 * <p>
 * For both amounts an absent field keeps the stored value and an explicit null clears it back to inherit.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class UpsertFeeRuleOverride {
    @NotNull
    private Long feeRuleId;

    private Long classificationId;

    private Long aircraftTypeId;

    @DecimalMin("0")
    private JsonNullable<BigDecimal> overrideAmount = JsonNullable.undefined();

    @DecimalMin("0")
    private JsonNullable<BigDecimal> overrideCaaAmount = JsonNullable.undefined();

    @Schema(description = "version the client last read; omit to skip the concurrency check")
    private Long expectedVersion;
}
