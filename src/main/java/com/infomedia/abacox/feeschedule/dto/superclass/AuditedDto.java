package com.infomedia.abacox.feeschedule.dto.superclass;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.infomedia.abacox.feeschedule.constants.DateTimePattern;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.LocalDateTime;

@AllArgsConstructor
@NoArgsConstructor
@Data
@SuperBuilder
public class AuditedDto {
    @JsonFormat(pattern = DateTimePattern.DATE_TIME)
    @Schema(description = "created date", example = "2021-08-01T00:00:00")
    LocalDateTime createdDate;
    @JsonFormat(pattern = DateTimePattern.DATE_TIME)
    @Schema(description = "last modified date", example = "2021-08-01T00:00:00")
    LocalDateTime lastModifiedDate;
}
