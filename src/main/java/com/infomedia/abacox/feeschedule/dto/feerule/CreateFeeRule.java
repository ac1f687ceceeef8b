package com.infomedia.abacox.feeschedule.dto.feerule;

import com.infomedia.abacox.feeschedule.component.feeengine.CalculationBasis;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO for creating {@link com.infomedia.abacox.feeschedule.db.entity.FeeRule}
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class CreateFeeRule {
    @NotBlank
    @Size(max = 100)
    private String feeName;

    @NotBlank
    @Size(max = 50)
    private String feeCode;

    private Long appliesToClassificationId;

    @NotNull
    @DecimalMin("0")
    private BigDecimal amount;

    @Pattern(regexp = "[A-Z]{3}")
    private String currency = "USD";

    @NotNull
    private Boolean taxable;

    @NotNull
    private Boolean potentiallyWaivableByFuelUplift;

    @NotNull
    private Boolean manuallyWaivable = false;

    @NotNull
    private CalculationBasis calculationBasis = CalculationBasis.NOT_APPLICABLE;

    @NotNull
    private Boolean hasCaaOverride = false;

    @DecimalMin("0")
    private BigDecimal caaOverrideAmount;

    @NotNull
    private Boolean primaryFee = false;
}
