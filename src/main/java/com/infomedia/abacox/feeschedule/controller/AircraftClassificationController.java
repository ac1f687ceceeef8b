package com.infomedia.abacox.feeschedule.controller;

import com.infomedia.abacox.feeschedule.component.modeltools.ModelConverter;
import com.infomedia.abacox.feeschedule.db.entity.AircraftClassification;
import com.infomedia.abacox.feeschedule.dto.aircraftclassification.AircraftClassificationDto;
import com.infomedia.abacox.feeschedule.dto.aircraftclassification.CreateAircraftClassification;
import com.infomedia.abacox.feeschedule.dto.aircraftclassification.UpdateAircraftClassification;
import com.infomedia.abacox.feeschedule.service.AircraftClassificationService;
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
@Tag(name = "AircraftClassification", description = "Aircraft Classification API")
@RequestMapping("/api/aircraftClassification")
public class AircraftClassificationController {

    private final AircraftClassificationService aircraftClassificationService;
    private final ModelConverter modelConverter;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Page<AircraftClassificationDto> find(@Parameter(hidden = true) @Filter Specification<AircraftClassification> spec
            , @Parameter(hidden = true) Pageable pageable
            , @RequestParam(required = false) String filter, @RequestParam(required = false) Integer page
            , @RequestParam(required = false) Integer size, @RequestParam(required = false) String sort) {
        return modelConverter.mapPage(aircraftClassificationService.find(spec, pageable), AircraftClassificationDto.class);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public AircraftClassificationDto create(@Valid @RequestBody CreateAircraftClassification cDto) {
        return modelConverter.map(aircraftClassificationService.create(cDto), AircraftClassificationDto.class);
    }

    @PatchMapping(value = "{id}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public AircraftClassificationDto update(@PathVariable("id") Long id, @Valid @RequestBody UpdateAircraftClassification uDto) {
        return modelConverter.map(aircraftClassificationService.update(id, uDto), AircraftClassificationDto.class);
    }

    @GetMapping(value = "{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public AircraftClassificationDto get(@PathVariable("id") Long id) {
        return modelConverter.map(aircraftClassificationService.get(id), AircraftClassificationDto.class);
    }

    @DeleteMapping(value = "{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") Long id) {
        aircraftClassificationService.delete(id);
    }
}
