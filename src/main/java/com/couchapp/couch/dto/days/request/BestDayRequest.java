package com.couchapp.couch.dto.days.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class BestDayRequest {

    @NotNull
    @Min(1)
    private Integer runtime;

    private List<String> genres;
}
