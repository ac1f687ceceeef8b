package com.infomedia.abacox.feeschedule.controller;

import com.infomedia.abacox.feeschedule.component.modeltools.ModelConverter;
import com.infomedia.abacox.feeschedule.component.feeengine.PriorityAssignment;
import com.infomedia.abacox.feeschedule.dto.waivertier.CreateWaiverTier;
import com.infomedia.abacox.feeschedule.dto.waivertier.PriorityAssignmentDto;
import com.infomedia.abacox.feeschedule.dto.waivertier.ReorderResultDto;
import com.infomedia.abacox.feeschedule.dto.waivertier.ReorderWaiverTiers;
import com.infomedia.abacox.feeschedule.dto.waivertier.UpdateWaiverTier;
import com.infomedia.abacox.feeschedule.dto.waivertier.WaiverTierDto;
import com.infomedia.abacox.feeschedule.service.WaiverTierService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequiredArgsConstructor
@RestController
@Tag(name = "WaiverTier", description = "Fuel Uplift Waiver Tier API")
@RequestMapping("/api/waiverTier")
public class WaiverTierController {

    private final WaiverTierService waiverTierService;
    private final ModelConverter modelConverter;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<WaiverTierDto> findAll() {
        return modelConverter.mapList(waiverTierService.findAllOrdered(), WaiverTierDto.class);
    }

    @GetMapping(value = "{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public WaiverTierDto get(@PathVariable("id") Long id) {
        return modelConverter.map(waiverTierService.get(id), WaiverTierDto.class);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public WaiverTierDto create(@Valid @RequestBody CreateWaiverTier cDto) {
        return modelConverter.map(waiverTierService.create(cDto), WaiverTierDto.class);
    }

    @PatchMapping(value = "{id}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public WaiverTierDto update(@PathVariable("id") Long id, @Valid @RequestBody UpdateWaiverTier uDto) {
        return modelConverter.map(waiverTierService.update(id, uDto), WaiverTierDto.class);
    }

    @DeleteMapping(value = "{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") Long id) {
        waiverTierService.delete(id);
    }

    @PutMapping(value = "/reorder", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ReorderResultDto reorder(@Valid @RequestBody ReorderWaiverTiers reorderDto) {
        List<PriorityAssignment> assignments = waiverTierService.reorder(reorderDto.getTierIds());
        return new ReorderResultDto(modelConverter.mapList(assignments, PriorityAssignmentDto.class), findAll());
    }
}
