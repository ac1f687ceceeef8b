package com.infomedia.abacox.feeschedule.service;

import com.infomedia.abacox.feeschedule.component.feeengine.InvalidFeeConfigurationException;
import com.infomedia.abacox.feeschedule.config.ConfigKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfigServiceTest {

    @Mock
    private ConfigManagerService configManagerService;

    @InjectMocks
    private ConfigService configService;

    @Captor
    private ArgumentCaptor<Map<String, String>> configCaptor;

    @Test
    @DisplayName("Should parse the tax rate and fall back to its default")
    void shouldReadDecimalWithDefault() {
        // Given
        when(configManagerService.getValue("taxRate", "0.08")).thenReturn("0.08");

        // When / Then
        assertThat(configService.getDecimal(ConfigKey.TAX_RATE)).isEqualByComparingTo("0.08");
    }

    @Test
    @DisplayName("A stored value that is not a number should be reported as invalid configuration")
    void shouldRejectMalformedDecimal() {
        // Given
        when(configManagerService.getValue("taxRate", "0.08")).thenReturn("eight percent");

        // When / Then
        assertThatThrownBy(() -> configService.getDecimal(ConfigKey.TAX_RATE))
                .isInstanceOf(InvalidFeeConfigurationException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("Updates should keep only known public keys with a value")
    void shouldFilterUpdates() {
        // Given
        Map<String, Object> update = new HashMap<>();
        update.put("taxRate", 0.1);
        update.put("noPrimaryFeesFallback", null);
        update.put("unknownKey", "x");

        // When
        configService.updatePublicConfiguration(update);

        // Then
        verify(configManagerService).updateConfiguration(configCaptor.capture());
        assertThat(configCaptor.getValue()).containsExactly(Map.entry("taxRate", "0.1"));
    }
}
