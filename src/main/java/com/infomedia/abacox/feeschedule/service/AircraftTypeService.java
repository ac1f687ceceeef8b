package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.db.entity.AircraftType;
import com.infomedia.abacox.feeschedule.db.repository.AircraftClassificationRepository;
import com.infomedia.abacox.feeschedule.db.repository.AircraftTypeRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleOverrideRepository;
import com.infomedia.abacox.feeschedule.dto.aircrafttype.CreateAircraftType;
import com.infomedia.abacox.feeschedule.dto.aircrafttype.UpdateAircraftType;
import com.infomedia.abacox.feeschedule.service.common.CrudService;
import com.infomedia.abacox.feeschedule.service.common.ReferenceConflictException;
import com.infomedia.abacox.feeschedule.service.common.ResourceNotFoundException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Log4j2
public class AircraftTypeService extends CrudService<AircraftType, Long, AircraftTypeRepository> {

    private final AircraftClassificationRepository classificationRepository;
    private final FeeRuleOverrideRepository feeRuleOverrideRepository;
    private final NameLookupService nameLookupService;

    public AircraftTypeService(AircraftTypeRepository repository,
                               AircraftClassificationRepository classificationRepository,
                               FeeRuleOverrideRepository feeRuleOverrideRepository,
                               NameLookupService nameLookupService) {
        super(repository);
        this.classificationRepository = classificationRepository;
        this.feeRuleOverrideRepository = feeRuleOverrideRepository;
        this.nameLookupService = nameLookupService;
    }

    /**
     * Creates the aircraft type already assigned to its classification and with its minimum fuel
     * for waiver, so it shows up in the fee schedule in one step.
     */
    @Transactional
    public AircraftType create(CreateAircraftType cDto) {
        if (getRepository().existsByNameIgnoreCase(cDto.getName())) {
            throw new ReferenceConflictException("Aircraft type '" + cDto.getName() + "' already exists");
        }
        requireClassification(cDto.getClassificationId());
        AircraftType aircraftType = AircraftType.builder()
                .name(cDto.getName())
                .classificationId(cDto.getClassificationId())
                .baseMinFuelGallonsForWaiver(cDto.getBaseMinFuelGallonsForWaiver())
                .defaultMaxGrossWeightLbs(cDto.getDefaultMaxGrossWeightLbs())
                .build();
        AircraftType saved = save(aircraftType);
        log.info("Created aircraft type {} '{}' in classification {} with minimum fuel {}",
                saved.getId(), saved.getName(), saved.getClassificationId(), saved.getBaseMinFuelGallonsForWaiver());
        return saved;
    }

    @Transactional
    public AircraftType update(Long id, UpdateAircraftType uDto) {
        AircraftType aircraftType = get(id);
        uDto.getName().ifPresent(name -> {
            if (!name.equalsIgnoreCase(aircraftType.getName()) && getRepository().existsByNameIgnoreCase(name)) {
                throw new ReferenceConflictException("Aircraft type '" + name + "' already exists");
            }
            aircraftType.setName(name);
        });
        uDto.getClassificationId().ifPresent(classificationId -> {
            requireClassification(classificationId);
            aircraftType.setClassificationId(classificationId);
        });
        uDto.getBaseMinFuelGallonsForWaiver().ifPresent(aircraftType::setBaseMinFuelGallonsForWaiver);
        uDto.getDefaultMaxGrossWeightLbs().ifPresent(aircraftType::setDefaultMaxGrossWeightLbs);
        AircraftType saved = save(aircraftType);
        nameLookupService.evictAircraftType(id);
        return saved;
    }

    /**
     * Deletes the aircraft type together with its aircraft-level overrides.
     */
    @Transactional
    public void delete(Long id) {
        AircraftType aircraftType = get(id);
        feeRuleOverrideRepository.deleteAllByAircraftTypeId(id);
        getRepository().delete(aircraftType);
        nameLookupService.evictAircraftType(id);
        log.info("Deleted aircraft type {} '{}' and its overrides", id, aircraftType.getName());
    }

    private void requireClassification(Long classificationId) {
        if (!classificationRepository.existsById(classificationId)) {
            throw new ResourceNotFoundException("Aircraft classification", classificationId);
        }
    }

    @Override
    protected String entityName() {
        return "Aircraft type";
    }
}
