package com.infomedia.abacox.feeschedule.controller;

import com.infomedia.abacox.feeschedule.component.modeltools.ModelConverter;
import com.infomedia.abacox.feeschedule.db.entity.FeeRuleOverride;
import com.infomedia.abacox.feeschedule.dto.feeruleoverride.DeleteFeeRuleOverride;
import com.infomedia.abacox.feeschedule.dto.feeruleoverride.FeeRuleOverrideDto;
import com.infomedia.abacox.feeschedule.dto.feeruleoverride.UpsertFeeRuleOverride;
import com.infomedia.abacox.feeschedule.service.FeeRuleOverrideService;
import com.turkraft.springfilter.boot.Filter;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequiredArgsConstructor
@RestController
@Tag(name = "FeeRuleOverride", description = "Fee Rule Override API")
@RequestMapping("/api/feeRuleOverride")
public class FeeRuleOverrideController {

    private final FeeRuleOverrideService feeRuleOverrideService;
    private final ModelConverter modelConverter;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Page<FeeRuleOverrideDto> find(@Parameter(hidden = true) @Filter Specification<FeeRuleOverride> spec
            , @Parameter(hidden = true) Pageable pageable
            , @RequestParam(required = false) String filter, @RequestParam(required = false) Integer page
            , @RequestParam(required = false) Integer size, @RequestParam(required = false) String sort) {
        return modelConverter.mapPage(feeRuleOverrideService.find(spec, pageable), FeeRuleOverrideDto.class);
    }

    @GetMapping(value = "/feeRule/{feeRuleId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<FeeRuleOverrideDto> findByFeeRule(@PathVariable("feeRuleId") Long feeRuleId) {
        return modelConverter.mapList(feeRuleOverrideService.findByFeeRule(feeRuleId), FeeRuleOverrideDto.class);
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public FeeRuleOverrideDto upsert(@Valid @RequestBody UpsertFeeRuleOverride uDto) {
        return modelConverter.map(feeRuleOverrideService.upsert(uDto), FeeRuleOverrideDto.class);
    }

    @DeleteMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@Valid @RequestBody DeleteFeeRuleOverride dDto) {
        feeRuleOverrideService.delete(dDto);
    }
}
