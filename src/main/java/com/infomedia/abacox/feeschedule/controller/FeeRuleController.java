package com.infomedia.abacox.feeschedule.controller;

import com.infomedia.abacox.feeschedule.component.modeltools.ModelConverter;
import com.infomedia.abacox.feeschedule.db.entity.FeeRule;
import com.infomedia.abacox.feeschedule.dto.feerule.FeeRuleDto;
import com.infomedia.abacox.feeschedule.dto.feerule.CreateFeeRule;
import com.infomedia.abacox.feeschedule.dto.feerule.UpdateFeeRule;
import com.infomedia.abacox.feeschedule.service.FeeRuleService;
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

@RequiredArgsConstructor
@RestController
@Tag(name = "FeeRule", description = "Fee Rule API")
@RequestMapping("/api/feeRule")
public class FeeRuleController {

    private final FeeRuleService feeRuleService;
    private final ModelConverter modelConverter;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Page<FeeRuleDto> find(@Parameter(hidden = true) @Filter Specification<FeeRule> spec
            , @Parameter(hidden = true) Pageable pageable
            , @RequestParam(required = false) String filter, @RequestParam(required = false) Integer page
            , @RequestParam(required = false) Integer size, @RequestParam(required = false) String sort) {
        return modelConverter.mapPage(feeRuleService.find(spec, pageable), FeeRuleDto.class);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public FeeRuleDto create(@Valid @RequestBody CreateFeeRule cDto) {
        return modelConverter.map(feeRuleService.create(cDto), FeeRuleDto.class);
    }

    @PatchMapping(value = "{id}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public FeeRuleDto update(@PathVariable("id") Long id, @Valid @RequestBody UpdateFeeRule uDto) {
        return modelConverter.map(feeRuleService.update(id, uDto), FeeRuleDto.class);
    }

    @GetMapping(value = "{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public FeeRuleDto get(@PathVariable("id") Long id) {
        return modelConverter.map(feeRuleService.get(id), FeeRuleDto.class);
    }

    @DeleteMapping(value = "{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") Long id) {
        feeRuleService.delete(id);
    }
}
