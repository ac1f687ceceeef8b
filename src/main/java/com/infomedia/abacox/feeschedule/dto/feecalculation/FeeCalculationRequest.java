package com.infomedia.abacox.feeschedule.dto.feecalculation;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class FeeCalculationRequest {
    @NotNull
    private Long aircraftTypeId;

    @NotNull
    private Boolean caaCustomer = false;

    @NotNull
    @DecimalMin("0")
    private BigDecimal fuelUpliftGallons;

    @NotNull
    @DecimalMin("0")
    private BigDecimal fuelPricePerGallon;

    @Valid
    private List<RequestedServiceDto> requestedServices = new ArrayList<>();

    private List<String> manualWaiverFeeCodes = new ArrayList<>();
}
