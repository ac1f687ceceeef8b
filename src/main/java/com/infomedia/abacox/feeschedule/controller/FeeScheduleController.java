package com.infomedia.abacox.feeschedule.controller;

import com.infomedia.abacox.feeschedule.dto.feeschedule.FeeScheduleDto;
import com.infomedia.abacox.feeschedule.service.FeeScheduleService;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.DecimalMin;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RequiredArgsConstructor
@RestController
@Tag(name = "FeeSchedule", description = "Consolidated Fee Schedule API")
@RequestMapping("/api/feeSchedule")
public class FeeScheduleController {

    private final FeeScheduleService feeScheduleService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public FeeScheduleDto getFeeSchedule(
            @Parameter(description = "fuel uplift as a multiple of each aircraft's minimum fuel, used to flag waived fees")
            @RequestParam(required = false) @DecimalMin("0") BigDecimal upliftMultiple) {
        return feeScheduleService.getFeeSchedule(upliftMultiple);
    }
}
