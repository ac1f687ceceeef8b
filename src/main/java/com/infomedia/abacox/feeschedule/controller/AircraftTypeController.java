package com.infomedia.abacox.feeschedule.controller;

import com.infomedia.abacox.feeschedule.component.modeltools.ModelConverter;
import com.infomedia.abacox.feeschedule.db.entity.AircraftType;
import com.infomedia.abacox.feeschedule.dto.aircrafttype.AircraftTypeDto;
import com.infomedia.abacox.feeschedule.dto.aircrafttype.CreateAircraftType;
import com.infomedia.abacox.feeschedule.dto.aircrafttype.UpdateAircraftType;
import com.infomedia.abacox.feeschedule.service.AircraftTypeService;
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
@Tag(name = "AircraftType", description = "Aircraft Type API")
@RequestMapping("/api/aircraftType")
public class AircraftTypeController {

    private final AircraftTypeService aircraftTypeService;
    private final ModelConverter modelConverter;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Page<AircraftTypeDto> find(@Parameter(hidden = true) @Filter Specification<AircraftType> spec
            , @Parameter(hidden = true) Pageable pageable
            , @RequestParam(required = false) String filter, @RequestParam(required = false) Integer page
            , @RequestParam(required = false) Integer size, @RequestParam(required = false) String sort) {
        return modelConverter.mapPage(aircraftTypeService.find(spec, pageable), AircraftTypeDto.class);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public AircraftTypeDto create(@Valid @RequestBody CreateAircraftType cDto) {
        return modelConverter.map(aircraftTypeService.create(cDto), AircraftTypeDto.class);
    }

    @PatchMapping(value = "{id}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public AircraftTypeDto update(@PathVariable("id") Long id, @Valid @RequestBody UpdateAircraftType uDto) {
        return modelConverter.map(aircraftTypeService.update(id, uDto), AircraftTypeDto.class);
    }

    @GetMapping(value = "{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public AircraftTypeDto get(@PathVariable("id") Long id) {
        return modelConverter.map(aircraftTypeService.get(id), AircraftTypeDto.class);
    }

    @DeleteMapping(value = "{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") Long id) {
        aircraftTypeService.delete(id);
    }
}
