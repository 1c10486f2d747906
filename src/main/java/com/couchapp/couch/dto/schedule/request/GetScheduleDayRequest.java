package com.couchapp.couch.dto.schedule.request;

import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GetScheduleDayRequest {
    @NotNull private LocalDate date;
}
