package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.feeengine.CalculationBasis;
import com.infomedia.abacox.feeschedule.component.feeengine.InvalidFeeConfigurationException;
import com.infomedia.abacox.feeschedule.db.entity.FeeRule;
import com.infomedia.abacox.feeschedule.db.repository.AircraftClassificationRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleOverrideRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleRepository;
import com.infomedia.abacox.feeschedule.dto.feerule.CreateFeeRule;
import com.infomedia.abacox.feeschedule.dto.feerule.UpdateFeeRule;
import com.infomedia.abacox.feeschedule.service.common.CrudService;
import com.infomedia.abacox.feeschedule.service.common.ReferenceConflictException;
import com.infomedia.abacox.feeschedule.service.common.ResourceNotFoundException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;

@Service
@Log4j2
public class FeeRuleService extends CrudService<FeeRule, Long, FeeRuleRepository> {

    private final FeeRuleOverrideRepository feeRuleOverrideRepository;
    private final AircraftClassificationRepository classificationRepository;

    public FeeRuleService(FeeRuleRepository repository,
                          FeeRuleOverrideRepository feeRuleOverrideRepository,
                          AircraftClassificationRepository classificationRepository) {
        super(repository);
        this.feeRuleOverrideRepository = feeRuleOverrideRepository;
        this.classificationRepository = classificationRepository;
    }

    @Transactional
    public FeeRule create(CreateFeeRule cDto) {
        if (getRepository().existsByFeeCode(cDto.getFeeCode())) {
            throw new ReferenceConflictException("Fee code '" + cDto.getFeeCode() + "' is already in use");
        }
        if (cDto.getAppliesToClassificationId() != null) {
            requireClassification(cDto.getAppliesToClassificationId());
        }
        FeeRule feeRule = FeeRule.builder()
                .feeName(cDto.getFeeName())
                .feeCode(cDto.getFeeCode())
                .appliesToClassificationId(cDto.getAppliesToClassificationId())
                .amount(cDto.getAmount())
                .currency(cDto.getCurrency() == null ? "USD" : cDto.getCurrency())
                .taxable(cDto.getTaxable())
                .potentiallyWaivableByFuelUplift(cDto.getPotentiallyWaivableByFuelUplift())
                .manuallyWaivable(cDto.getManuallyWaivable())
                .calculationBasis(cDto.getCalculationBasis() == null ? CalculationBasis.NOT_APPLICABLE : cDto.getCalculationBasis())
                .hasCaaOverride(cDto.getHasCaaOverride())
                .caaOverrideAmount(cDto.getCaaOverrideAmount())
                .primaryFee(cDto.getPrimaryFee())
                .build();
        validateCaaOverride(feeRule);
        FeeRule saved = save(feeRule);
        log.info("Created fee rule {} '{}' with amount {}", saved.getId(), saved.getFeeCode(), saved.getAmount());
        return saved;
    }

    @Transactional
    public FeeRule update(Long id, UpdateFeeRule uDto) {
        FeeRule feeRule = get(id);
        if (uDto.getFeeCode().isPresent()) {
            String feeCode = uDto.getFeeCode().get();
            if (!Objects.equals(feeCode, feeRule.getFeeCode()) && getRepository().existsByFeeCode(feeCode)) {
                throw new ReferenceConflictException("Fee code '" + feeCode + "' is already in use");
            }
            feeRule.setFeeCode(feeCode);
        }
        uDto.getAppliesToClassificationId().ifPresent(classificationId -> {
            if (classificationId != null) {
                requireClassification(classificationId);
            }
            feeRule.setAppliesToClassificationId(classificationId);
        });
        uDto.getFeeName().ifPresent(feeRule::setFeeName);
        uDto.getAmount().ifPresent(feeRule::setAmount);
        uDto.getCurrency().ifPresent(feeRule::setCurrency);
        uDto.getTaxable().ifPresent(feeRule::setTaxable);
        uDto.getPotentiallyWaivableByFuelUplift().ifPresent(feeRule::setPotentiallyWaivableByFuelUplift);
        uDto.getManuallyWaivable().ifPresent(feeRule::setManuallyWaivable);
        uDto.getCalculationBasis().ifPresent(feeRule::setCalculationBasis);
        uDto.getHasCaaOverride().ifPresent(feeRule::setHasCaaOverride);
        uDto.getCaaOverrideAmount().ifPresent(feeRule::setCaaOverrideAmount);
        uDto.getPrimaryFee().ifPresent(feeRule::setPrimaryFee);
        validateCaaOverride(feeRule);
        return save(feeRule);
    }

    /**
     * Fee rules are never deleted while an override still points to them.
     */
    @Transactional
    public void delete(Long id) {
        FeeRule feeRule = get(id);
        if (feeRuleOverrideRepository.existsByFeeRuleId(id)) {
            throw new ReferenceConflictException("Fee rule '" + feeRule.getFeeCode()
                    + "' still has overrides; delete them first");
        }
        getRepository().delete(feeRule);
        log.info("Deleted fee rule {} '{}'", id, feeRule.getFeeCode());
    }

    private void validateCaaOverride(FeeRule feeRule) {
        if (Boolean.TRUE.equals(feeRule.getHasCaaOverride()) && feeRule.getCaaOverrideAmount() == null) {
            throw new InvalidFeeConfigurationException("Fee rule '" + feeRule.getFeeCode()
                    + "' is flagged with a CAA override but has no CAA amount");
        }
    }

    private void requireClassification(Long classificationId) {
        if (!classificationRepository.existsById(classificationId)) {
            throw new ResourceNotFoundException("Aircraft classification", classificationId);
        }
    }

    @Override
    protected String entityName() {
        return "Fee rule";
    }
}
