package com.infomedia.abacox.feeschedule.controller;

import com.infomedia.abacox.feeschedule.dto.feecalculation.FeeCalculationRequest;
import com.infomedia.abacox.feeschedule.dto.feecalculation.FeeCalculationResultDto;
import com.infomedia.abacox.feeschedule.service.FeeCalculationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@Tag(name = "FeeCalculation", description = "Transaction Fee Calculation API")
@RequestMapping("/api/feeCalculation")
public class FeeCalculationController {

    private final FeeCalculationService feeCalculationService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public FeeCalculationResultDto calculate(@Valid @RequestBody FeeCalculationRequest request) {
        return feeCalculationService.calculate(request);
    }
}
