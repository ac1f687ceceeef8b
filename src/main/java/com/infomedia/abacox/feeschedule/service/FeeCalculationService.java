package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.feeengine.AircraftContext;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeResolver;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeRuleInfo;
import com.infomedia.abacox.feeschedule.component.feeengine.InvalidFeeConfigurationException;
import com.infomedia.abacox.feeschedule.component.feeengine.OverrideIndex;
import com.infomedia.abacox.feeschedule.component.feeengine.PricingMode;
import com.infomedia.abacox.feeschedule.component.feeengine.ResolvedFee;
import com.infomedia.abacox.feeschedule.component.feeengine.WaivedFeeSet;
import com.infomedia.abacox.feeschedule.component.feeengine.WaiverEvaluator;
import com.infomedia.abacox.feeschedule.config.ConfigKey;
import com.infomedia.abacox.feeschedule.db.entity.AircraftType;
import com.infomedia.abacox.feeschedule.db.repository.AircraftTypeRepository;
import com.infomedia.abacox.feeschedule.db.repository.FeeRuleRepository;
import com.infomedia.abacox.feeschedule.dto.feecalculation.FeeCalculationRequest;
import com.infomedia.abacox.feeschedule.dto.feecalculation.FeeCalculationResultDto;
import com.infomedia.abacox.feeschedule.dto.feecalculation.LineItemDto;
import com.infomedia.abacox.feeschedule.dto.feecalculation.LineItemDto.LineItemType;
import com.infomedia.abacox.feeschedule.dto.feecalculation.LineItemDto.WaiverSource;
import com.infomedia.abacox.feeschedule.dto.feecalculation.RequestedServiceDto;
import com.infomedia.abacox.feeschedule.service.common.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Itemized price of one fuelling transaction: fuel, requested fees at the aircraft's resolved
 * prices, automatic and manual waivers, and tax.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class FeeCalculationService {

    private static final int MONEY_SCALE = 2;

    private final AircraftTypeRepository aircraftTypeRepository;
    private final FeeRuleRepository feeRuleRepository;
    private final FeeEngineSnapshotService snapshotService;
    private final FeeResolver feeResolver;
    private final WaiverEvaluator waiverEvaluator;
    private final ConfigService configService;

    @Transactional(readOnly = true)
    public FeeCalculationResultDto calculate(FeeCalculationRequest request) {
        AircraftType aircraftType = aircraftTypeRepository.findById(request.getAircraftTypeId())
                .orElseThrow(() -> new ResourceNotFoundException("Aircraft type", request.getAircraftTypeId()));
        AircraftContext aircraft = FeeEngineSnapshotService.toAircraftContext(aircraftType);
        boolean caaCustomer = Boolean.TRUE.equals(request.getCaaCustomer());
        PricingMode pricing = caaCustomer ? PricingMode.CAA : PricingMode.STANDARD;
        List<RequestedServiceDto> services = request.getRequestedServices() == null
                ? List.of() : request.getRequestedServices();
        Set<String> manualWaiverCodes = request.getManualWaiverFeeCodes() == null
                ? Set.of() : new LinkedHashSet<>(request.getManualWaiverFeeCodes());

        Map<String, FeeRuleInfo> rules = loadRequestedRules(services, aircraft);
        validateManualWaivers(manualWaiverCodes, rules);

        OverrideIndex overrides = OverrideIndex.of(snapshotService.loadOverrides());
        WaivedFeeSet waivers = waiverEvaluator.evaluate(snapshotService.loadWaiverTiers(), aircraft,
                request.getFuelUpliftGallons(), caaCustomer);

        List<LineItemDto> lineItems = new ArrayList<>();
        BigDecimal fuelAmount = money(request.getFuelUpliftGallons().multiply(request.getFuelPricePerGallon()));
        lineItems.add(LineItemDto.builder()
                .lineItemType(LineItemType.FUEL)
                .description("Fuel (" + request.getFuelUpliftGallons().stripTrailingZeros().toPlainString() + " gallons)")
                .quantity(request.getFuelUpliftGallons())
                .unitPrice(request.getFuelPricePerGallon())
                .amount(fuelAmount)
                .taxable(true)
                .build());

        Set<String> waivedCodes = new HashSet<>();
        for (RequestedServiceDto service : services) {
            FeeRuleInfo rule = rules.get(service.getFeeCode());
            BigDecimal quantity = service.getQuantity() == null ? BigDecimal.ONE : service.getQuantity();
            ResolvedFee resolved = feeResolver.resolve(rule, aircraft, overrides, pricing);
            BigDecimal feeAmount = money(resolved.finalAmount().multiply(quantity));
            lineItems.add(LineItemDto.builder()
                    .lineItemType(LineItemType.FEE)
                    .description(rule.feeName())
                    .feeCode(rule.feeCode())
                    .quantity(quantity)
                    .unitPrice(resolved.finalAmount())
                    .amount(feeAmount)
                    .taxable(rule.taxable())
                    .build());

            WaiverSource source = null;
            if (waivers.isWaived(rule)) {
                source = WaiverSource.AUTOMATIC;
            } else if (manualWaiverCodes.contains(rule.feeCode())) {
                source = WaiverSource.MANUAL;
            }
            if (source != null && waivedCodes.add(rule.feeCode())) {
                lineItems.add(LineItemDto.builder()
                        .lineItemType(LineItemType.WAIVER)
                        .description((source == WaiverSource.AUTOMATIC ? "Fuel Uplift Waiver (" : "Manual Waiver (")
                                + rule.feeName() + ")")
                        .feeCode(rule.feeCode())
                        .quantity(quantity)
                        .amount(feeAmount.negate())
                        .taxable(false)
                        .waiverSource(source)
                        .build());
            }
        }

        BigDecimal taxableBase = lineItems.stream()
                .filter(item -> Boolean.TRUE.equals(item.getTaxable()))
                .filter(item -> item.getLineItemType() == LineItemType.FUEL || item.getLineItemType() == LineItemType.FEE)
                .map(LineItemDto::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal taxAmount = calculateTax(taxableBase);
        if (taxAmount.signum() > 0) {
            lineItems.add(LineItemDto.builder()
                    .lineItemType(LineItemType.TAX)
                    .description("Tax")
                    .amount(taxAmount)
                    .taxable(false)
                    .build());
        }

        BigDecimal totalFees = sum(lineItems, LineItemType.FEE);
        BigDecimal totalWaivers = sum(lineItems, LineItemType.WAIVER);
        BigDecimal grandTotal = fuelAmount.add(totalFees).add(totalWaivers).add(taxAmount);

        log.debug("Calculated transaction for aircraft type {} ({}): {} line items, grand total {}",
                aircraft.aircraftTypeId(), pricing, lineItems.size(), grandTotal);

        return FeeCalculationResultDto.builder()
                .aircraftTypeId(aircraft.aircraftTypeId())
                .caaApplied(caaCustomer)
                .upliftRatio(waivers.upliftRatio())
                .waiverTierId(waivers.winningTierId())
                .waiverTierName(waivers.winningTierName())
                .lineItems(lineItems)
                .fuelSubtotal(fuelAmount)
                .totalFees(totalFees)
                .totalWaivers(totalWaivers.abs())
                .taxAmount(taxAmount)
                .grandTotal(grandTotal)
                .build();
    }

    private Map<String, FeeRuleInfo> loadRequestedRules(List<RequestedServiceDto> services, AircraftContext aircraft) {
        Set<String> codes = services.stream().map(RequestedServiceDto::getFeeCode).collect(Collectors.toCollection(LinkedHashSet::new));
        if (codes.size() != services.size()) {
            throw new InvalidFeeConfigurationException("Each fee code may be requested only once");
        }
        Map<String, FeeRuleInfo> rules = feeRuleRepository.findAllByFeeCodeIn(codes).stream()
                .map(FeeEngineSnapshotService::toFeeRuleInfo)
                .collect(Collectors.toMap(FeeRuleInfo::feeCode, Function.identity()));
        for (String code : codes) {
            FeeRuleInfo rule = rules.get(code);
            if (rule == null) {
                throw new InvalidFeeConfigurationException("Unknown fee code '" + code + "'");
            }
            if (!rule.appliesTo(aircraft)) {
                throw new InvalidFeeConfigurationException("Fee '" + code + "' does not apply to aircraft classification "
                        + aircraft.classificationId());
            }
        }
        return rules;
    }

    private void validateManualWaivers(Set<String> manualWaiverCodes, Map<String, FeeRuleInfo> rules) {
        for (String code : manualWaiverCodes) {
            FeeRuleInfo rule = rules.get(code);
            if (rule == null) {
                throw new InvalidFeeConfigurationException("Manual waiver for fee '" + code + "' which was not requested");
            }
            if (!rule.manuallyWaivable()) {
                log.warn("Rejected manual waiver of fee '{}': not manually waivable", code);
                throw new InvalidFeeConfigurationException("Fee '" + code + "' cannot be waived manually");
            }
        }
    }

    private BigDecimal calculateTax(BigDecimal taxableBase) {
        if (taxableBase.signum() <= 0) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }
        return money(taxableBase.multiply(configService.getDecimal(ConfigKey.TAX_RATE)));
    }

    private static BigDecimal sum(List<LineItemDto> lineItems, LineItemType type) {
        return lineItems.stream()
                .filter(item -> item.getLineItemType() == type)
                .map(LineItemDto::getAmount)
                .reduce(BigDecimal.ZERO.setScale(MONEY_SCALE), BigDecimal::add);
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
