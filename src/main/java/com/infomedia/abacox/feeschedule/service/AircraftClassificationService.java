package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.db.entity.AircraftClassification;
import com.infomedia.abacox.feeschedule.db.repository.AircraftClassificationRepository;
import com.infomedia.abacox.feeschedule.db.repository.AircraftTypeRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleOverrideRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleRepository;
import com.infomedia.abacox.feeschedule.dto.aircraftclassification.CreateAircraftClassification;
import com.infomedia.abacox.feeschedule.dto.aircraftclassification.UpdateAircraftClassification;
import com.infomedia.abacox.feeschedule.service.common.CrudService;
import com.infomedia.abacox.feeschedule.service.common.ReferenceConflictException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Log4j2
public class AircraftClassificationService extends CrudService<AircraftClassification, Long, AircraftClassificationRepository> {

    private final AircraftTypeRepository aircraftTypeRepository;
    private final FeeRuleRepository feeRuleRepository;
    private final FeeRuleOverrideRepository feeRuleOverrideRepository;
    private final NameLookupService nameLookupService;

    public AircraftClassificationService(AircraftClassificationRepository repository,
                                         AircraftTypeRepository aircraftTypeRepository,
                                         FeeRuleRepository feeRuleRepository,
                                         FeeRuleOverrideRepository feeRuleOverrideRepository,
                                         NameLookupService nameLookupService) {
        super(repository);
        this.aircraftTypeRepository = aircraftTypeRepository;
        this.feeRuleRepository = feeRuleRepository;
        this.feeRuleOverrideRepository = feeRuleOverrideRepository;
        this.nameLookupService = nameLookupService;
    }

    @Transactional
    public AircraftClassification create(CreateAircraftClassification cDto) {
        if (getRepository().existsByNameIgnoreCase(cDto.getName())) {
            throw new ReferenceConflictException("Aircraft classification '" + cDto.getName() + "' already exists");
        }
        AircraftClassification classification = AircraftClassification.builder()
                .name(cDto.getName())
                .build();
        return save(classification);
    }

    @Transactional
    public AircraftClassification update(Long id, UpdateAircraftClassification uDto) {
        AircraftClassification classification = get(id);
        uDto.getName().ifPresent(name -> {
            if (!name.equalsIgnoreCase(classification.getName()) && getRepository().existsByNameIgnoreCase(name)) {
                throw new ReferenceConflictException("Aircraft classification '" + name + "' already exists");
            }
            classification.setName(name);
        });
        AircraftClassification saved = save(classification);
        nameLookupService.evictClassification(id);
        return saved;
    }

    @Transactional
    public void delete(Long id) {
        AircraftClassification classification = get(id);
        if (aircraftTypeRepository.existsByClassificationId(id)) {
            throw new ReferenceConflictException("Aircraft classification " + id + " is still assigned to aircraft types");
        }
        if (feeRuleRepository.existsByAppliesToClassificationId(id)) {
            throw new ReferenceConflictException("Aircraft classification " + id + " is still targeted by fee rules");
        }
        if (feeRuleOverrideRepository.existsByClassificationId(id)) {
            throw new ReferenceConflictException("Aircraft classification " + id + " still has fee overrides");
        }
        getRepository().delete(classification);
        nameLookupService.evictClassification(id);
        log.info("Deleted aircraft classification {} '{}'", id, classification.getName());
    }

    @Override
    protected String entityName() {
        return "Aircraft classification";
    }
}
