package com.infomedia.abacox.feeschedule.controller;

import com.infomedia.abacox.feeschedule.component.modeltools.ModelConverter;
import com.infomedia.abacox.feeschedule.dto.configuration.ConfigurationDto;
import com.infomedia.abacox.feeschedule.dto.configuration.UpdateConfigurationDto;
import com.infomedia.abacox.feeschedule.service.ConfigService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RequiredArgsConstructor
@RestController
@Tag(name = "Configuration", description = "Configuration controller")
@RequestMapping("/api/configuration")
public class ConfigController {

    private final ConfigService configService;
    private final ModelConverter modelConverter;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ConfigurationDto getConfiguration() {
        Map<String, Object> configMap = configService.getPublicConfiguration();
        return modelConverter.fromMap(configMap, ConfigurationDto.class);
    }

    @PatchMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ConfigurationDto updateConfiguration(@Valid @RequestBody UpdateConfigurationDto newConfig) {
        Map<String, Object> newConfigMap = modelConverter.toMap(newConfig);
        configService.updatePublicConfiguration(newConfigMap);
        return getConfiguration();
    }
}
