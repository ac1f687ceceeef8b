package com.infomedia.abacox.feeschedule.component.modeltools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.infomedia.abacox.feeschedule.component.feeengine.FeeCell;
import com.infomedia.abacox.feeschedule.component.feeengine.PriorityAssignment;
import com.infomedia.abacox.feeschedule.dto.feeschedule.FeeCellDto;
import com.infomedia.abacox.feeschedule.dto.waivertier.PriorityAssignmentDto;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.modelmapper.ModelMapper;
import org.modelmapper.convention.MatchingStrategies;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Entity and engine result to DTO mapping for the controllers, plus map conversion for the
 * configuration endpoint.
 */
@Component
public class ModelConverter {

    private final ModelMapper modelMapper;
    private final ObjectMapper objectMapper;

    public ModelConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        modelMapper = new ModelMapper();
        modelMapper.getConfiguration()
                .setMatchingStrategy(MatchingStrategies.STRICT)
                .setAmbiguityIgnored(true)
                .setFieldMatchingEnabled(true)
                .setFieldAccessLevel(org.modelmapper.config.Configuration.AccessLevel.PRIVATE);
        registerEngineResults();
    }

    /**
     * Engine results are records without bean getters, so they get explicit type maps instead of
     * implicit property matching.
     */
    private void registerEngineResults() {
        modelMapper.emptyTypeMap(FeeCell.class, FeeCellDto.class)
                .setConverter(context -> toFeeCellDto(context.getSource()));
        modelMapper.emptyTypeMap(PriorityAssignment.class, PriorityAssignmentDto.class)
                .setConverter(context -> new PriorityAssignmentDto(context.getSource().tierId(),
                        context.getSource().previousPriority(), context.getSource().newPriority()));
    }

    private static FeeCellDto toFeeCellDto(FeeCell cell) {
        return new FeeCellDto(cell.feeRuleId(), cell.feeCode(),
                cell.finalDisplayValue(), cell.aircraftOverride(), cell.sourceScope(), cell.revertToValue(),
                cell.classificationDefault(), cell.globalDefault(),
                cell.finalCaaDisplayValue(), cell.caaAircraftOverride(), cell.caaSourceScope(), cell.revertToCaaValue(),
                cell.classificationCaaDefault(), cell.globalCaaDefault(),
                cell.waived(), cell.caaWaived());
    }

    public <T> T map(Object sourceObject, Class<T> mapType) {
        return modelMapper.map(sourceObject, mapType);
    }

    public Map<String, Object> toMap(Object sourceObject) {
        TypeReference<Map<String, Object>> mapType = new TypeReference<>() {};
        return objectMapper.convertValue(sourceObject, mapType);
    }

    public <T> T fromMap(Map<String, Object> sourceMap, Class<T> type) {
        return objectMapper.convertValue(sourceMap, type);
    }

    public <T> List<T> mapList(List<?> sourceList, Class<T> mapType) {
        return sourceList
                .stream()
                .map(element -> modelMapper.map(element, mapType))
                .toList();
    }

    public <T> Page<T> mapPage(Page<?> sourcePage, Class<T> mapType) {
        return sourcePage.map(element -> modelMapper.map(element, mapType));
    }
}
