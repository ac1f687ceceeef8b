package com.infomedia.abacox.feeschedule.dto.feecalculation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class LineItemDto {

    public enum LineItemType {
        FUEL, FEE, WAIVER, TAX
    }

    public enum WaiverSource {
        AUTOMATIC, MANUAL
    }

    private LineItemType lineItemType;
    private String description;
    private String feeCode;
    private BigDecimal quantity;
    private BigDecimal unitPrice;
    private BigDecimal amount;
    private Boolean taxable;
    private WaiverSource waiverSource;
}
