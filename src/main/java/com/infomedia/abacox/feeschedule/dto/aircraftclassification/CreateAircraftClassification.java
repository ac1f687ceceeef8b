package com.infomedia.abacox.feeschedule.dto.aircraftclassification;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class CreateAircraftClassification {
    @NotBlank
    @Size(max = 100)
    private String name;
}
