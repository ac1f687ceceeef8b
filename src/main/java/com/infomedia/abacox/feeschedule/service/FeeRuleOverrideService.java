package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.feeengine.InvalidFeeConfigurationException;
import com.infomedia.abacox.feeschedule.component.feeengine.OverrideAmount;
import com.infomedia.abacox.feeschedule.db.entity.FeeRuleOverride;
import com.infomedia.abacox.feeschedule.db.repository.AircraftClassificationRepository;
import com.infomedia.abacox.feeschedule.db.repository.AircraftTypeRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleOverrideRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleRepository;
import com.infomedia.abacox.feeschedule.dto.feeruleoverride.DeleteFeeRuleOverride;
import com.infomedia.abacox.feeschedule.dto.feeruleoverride.UpsertFeeRuleOverride;
import com.infomedia.abacox.feeschedule.service.common.CrudService;
import com.infomedia.abacox.feeschedule.service.common.ResourceNotFoundException;
import com.infomedia.abacox.feeschedule.service.common.StaleWriteException;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes classification-level and aircraft-level overrides. The standard and CAA amounts of one
 * (scope, fee rule) pair are always written together in a single request.
 */
@Service
@Log4j2
public class FeeRuleOverrideService extends CrudService<FeeRuleOverride, Long, FeeRuleOverrideRepository> {

    private final FeeRuleRepository feeRuleRepository;
    private final AircraftClassificationRepository classificationRepository;
    private final AircraftTypeRepository aircraftTypeRepository;

    public FeeRuleOverrideService(FeeRuleOverrideRepository repository,
                                  FeeRuleRepository feeRuleRepository,
                                  AircraftClassificationRepository classificationRepository,
                                  AircraftTypeRepository aircraftTypeRepository) {
        super(repository);
        this.feeRuleRepository = feeRuleRepository;
        this.classificationRepository = classificationRepository;
        this.aircraftTypeRepository = aircraftTypeRepository;
    }

    @Transactional(readOnly = true)
    public List<FeeRuleOverride> findByFeeRule(Long feeRuleId) {
        return getRepository().findAllByFeeRuleId(feeRuleId);
    }

    /**
     * Creates or updates the override for the request's scope and fee rule. An absent amount keeps
     * the stored value and an explicit null resets it to inherit.
     *
     * @throws StaleWriteException when {@code expectedVersion} does not match the stored override
     */
    @Transactional
    public FeeRuleOverride upsert(UpsertFeeRuleOverride uDto) {
        requireSingleScope(uDto.getFeeRuleId(), uDto.getClassificationId(), uDto.getAircraftTypeId());
        if (!feeRuleRepository.existsById(uDto.getFeeRuleId())) {
            throw new ResourceNotFoundException("Fee rule", uDto.getFeeRuleId());
        }
        requireScopeExists(uDto.getClassificationId(), uDto.getAircraftTypeId());

        Optional<FeeRuleOverride> existing = findExisting(uDto.getFeeRuleId(), uDto.getClassificationId(), uDto.getAircraftTypeId());
        checkVersion(existing.orElse(null), uDto.getExpectedVersion());

        FeeRuleOverride override = existing.orElseGet(() -> FeeRuleOverride.builder()
                .feeRuleId(uDto.getFeeRuleId())
                .classificationId(uDto.getClassificationId())
                .aircraftTypeId(uDto.getAircraftTypeId())
                .build());
        uDto.getOverrideAmount().ifPresent(amount -> override.setOverrideAmount(validated(amount)));
        uDto.getOverrideCaaAmount().ifPresent(amount -> override.setOverrideCaaAmount(validated(amount)));

        FeeRuleOverride saved = flush(override);
        log.info("Upserted override of fee rule {} for {} {}: amount={}, caaAmount={}, version={}",
                saved.getFeeRuleId(), scopeLabel(saved), scopeId(saved),
                saved.getOverrideAmount(), saved.getOverrideCaaAmount(), saved.getVersion());
        return saved;
    }

    @Transactional
    public void delete(DeleteFeeRuleOverride dDto) {
        requireSingleScope(dDto.getFeeRuleId(), dDto.getClassificationId(), dDto.getAircraftTypeId());
        FeeRuleOverride override = findExisting(dDto.getFeeRuleId(), dDto.getClassificationId(), dDto.getAircraftTypeId())
                .orElseThrow(() -> new ResourceNotFoundException("No override of fee rule " + dDto.getFeeRuleId()
                        + " for the given scope"));
        checkVersion(override, dDto.getExpectedVersion());
        try {
            getRepository().delete(override);
            getRepository().flush();
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new StaleWriteException("Override " + override.getId() + " was changed by another request", e);
        }
        log.info("Deleted override of fee rule {} for {} {}", override.getFeeRuleId(), scopeLabel(override), scopeId(override));
    }

    private Optional<FeeRuleOverride> findExisting(Long feeRuleId, Long classificationId, Long aircraftTypeId) {
        if (aircraftTypeId != null) {
            return getRepository().findByAircraftTypeIdAndFeeRuleId(aircraftTypeId, feeRuleId);
        }
        return getRepository().findByClassificationIdAndFeeRuleId(classificationId, feeRuleId);
    }

    private FeeRuleOverride flush(FeeRuleOverride override) {
        try {
            return getRepository().saveAndFlush(override);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new StaleWriteException("Override of fee rule " + override.getFeeRuleId()
                    + " was changed by another request", e);
        } catch (DataIntegrityViolationException e) {
            throw new StaleWriteException("Override of fee rule " + override.getFeeRuleId()
                    + " was created by another request", e);
        }
    }

    private void checkVersion(FeeRuleOverride override, Long expectedVersion) {
        if (expectedVersion == null) {
            return;
        }
        if (override == null) {
            throw new StaleWriteException("Expected override version " + expectedVersion + " but the override no longer exists");
        }
        if (!Objects.equals(override.getVersion(), expectedVersion)) {
            log.warn("Rejected stale write to override {}: expected version {}, current {}",
                    override.getId(), expectedVersion, override.getVersion());
            throw new StaleWriteException("Override " + override.getId() + " is at version " + override.getVersion()
                    + ", expected " + expectedVersion);
        }
    }

    private void requireSingleScope(Long feeRuleId, Long classificationId, Long aircraftTypeId) {
        if ((classificationId == null) == (aircraftTypeId == null)) {
            throw new InvalidFeeConfigurationException("Override of fee rule " + feeRuleId
                    + " must target exactly one of classificationId or aircraftTypeId");
        }
    }

    private void requireScopeExists(Long classificationId, Long aircraftTypeId) {
        if (aircraftTypeId != null && !aircraftTypeRepository.existsById(aircraftTypeId)) {
            throw new ResourceNotFoundException("Aircraft type", aircraftTypeId);
        }
        if (classificationId != null && !classificationRepository.existsById(classificationId)) {
            throw new ResourceNotFoundException("Aircraft classification", classificationId);
        }
    }

    private static BigDecimal validated(BigDecimal amount) {
        return OverrideAmount.ofNullable(amount).toNullable();
    }

    private static String scopeLabel(FeeRuleOverride override) {
        return override.getAircraftTypeId() != null ? "aircraft type" : "classification";
    }

    private static Long scopeId(FeeRuleOverride override) {
        return override.getAircraftTypeId() != null ? override.getAircraftTypeId() : override.getClassificationId();
    }

    @Override
    protected String entityName() {
        return "Fee rule override";
    }
}
