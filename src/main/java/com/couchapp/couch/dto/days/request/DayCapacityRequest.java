package com.couchapp.couch.dto.days.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DayCapacityRequest {
    @NotNull @Min(0) @Max(6) private Integer weekday;
}
