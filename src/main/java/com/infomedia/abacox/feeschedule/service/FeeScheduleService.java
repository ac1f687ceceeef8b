package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.feeengine.AircraftScheduleRow;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeRuleInfo;
import com.infomedia.abacox.feeschedule.component.feeengine.NoPrimaryFeesFallback;
import com.infomedia.abacox.feeschedule.component.feeengine.PrimaryFeeColumns;
import com.infomedia.abacox.feeschedule.component.feeengine.ScheduleCompiler;
import com.infomedia.abacox.feeschedule.component.feeengine.ScheduleMatrix;
import com.infomedia.abacox.feeschedule.component.feeengine.WaiverScenario;
import com.infomedia.abacox.feeschedule.component.modeltools.ModelConverter;
import com.infomedia.abacox.feeschedule.config.ConfigKey;
import com.infomedia.abacox.feeschedule.dto.feeschedule.AircraftFeeRowDto;
import com.infomedia.abacox.feeschedule.dto.feeschedule.FeeCellDto;
import com.infomedia.abacox.feeschedule.dto.feeschedule.FeeRuleColumnDto;
import com.infomedia.abacox.feeschedule.dto.feeschedule.FeeScheduleDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Consolidated fee schedule: every aircraft type against every fee rule that applies to it.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class FeeScheduleService {

    private final FeeEngineSnapshotService snapshotService;
    private final ScheduleCompiler scheduleCompiler;
    private final ConfigService configService;
    private final NameLookupService nameLookupService;
    private final ModelConverter modelConverter;

    /**
     * @param upliftMultiple fuel uplift, as a multiple of each aircraft's minimum, used to flag
     *                       waived cells; {@code null} uses the configured default
     */
    public FeeScheduleDto getFeeSchedule(BigDecimal upliftMultiple) {
        BigDecimal multiple = upliftMultiple != null
                ? upliftMultiple
                : configService.getDecimal(ConfigKey.SCHEDULE_UPLIFT_MULTIPLE);
        WaiverScenario scenario = new WaiverScenario(multiple);

        FeeEngineSnapshot snapshot = snapshotService.load();
        ScheduleMatrix matrix = scheduleCompiler.compile(snapshot.aircraft(), snapshot.feeRules(),
                snapshot.overrides(), snapshot.waiverTiers(), scenario);

        NoPrimaryFeesFallback fallback = NoPrimaryFeesFallback.of(configService.getBoolean(ConfigKey.NO_PRIMARY_FEES_FALLBACK));
        PrimaryFeeColumns primary = fallback.selectPrimaryColumns(snapshot.feeRules());
        if (primary.fallbackApplied()) {
            log.debug("No fee rule is flagged primary, showing all {} rules as primary columns", primary.rules().size());
        }
        Set<Long> primaryIds = primary.rules().stream().map(FeeRuleInfo::id).collect(Collectors.toSet());

        List<FeeRuleColumnDto> primaryColumns = primary.rules().stream()
                .map(rule -> toColumn(rule, true))
                .toList();
        List<FeeRuleColumnDto> otherColumns = snapshot.feeRules().stream()
                .filter(rule -> !primaryIds.contains(rule.id()))
                .map(rule -> toColumn(rule, false))
                .toList();

        return FeeScheduleDto.builder()
                .upliftMultiple(multiple)
                .primaryFallbackApplied(primary.fallbackApplied())
                .primaryColumns(primaryColumns)
                .otherColumns(otherColumns)
                .rows(matrix.rows().stream().map(this::toRow).toList())
                .build();
    }

    private AircraftFeeRowDto toRow(AircraftScheduleRow row) {
        return AircraftFeeRowDto.builder()
                .aircraftTypeId(row.aircraftTypeId())
                .aircraftTypeName(nameLookupService.aircraftTypeName(row.aircraftTypeId()))
                .classificationId(row.classificationId())
                .classificationName(nameLookupService.classificationName(row.classificationId()))
                .baseMinFuelGallonsForWaiver(row.baseMinFuelGallonsForWaiver())
                .cells(modelConverter.mapList(row.cells(), FeeCellDto.class))
                .build();
    }

    private static FeeRuleColumnDto toColumn(FeeRuleInfo rule, boolean primary) {
        return FeeRuleColumnDto.builder()
                .feeRuleId(rule.id())
                .feeCode(rule.feeCode())
                .feeName(rule.feeName())
                .currency(rule.currency())
                .amount(rule.amount())
                .hasCaaOverride(rule.hasCaaOverride())
                .caaOverrideAmount(rule.caaOverrideAmount())
                .potentiallyWaivableByFuelUplift(rule.potentiallyWaivableByFuelUplift())
                .primary(primary)
                .build();
    }
}
