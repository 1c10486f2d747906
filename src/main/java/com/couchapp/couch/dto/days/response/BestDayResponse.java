package com.couchapp.couch.dto.days.response;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class BestDayResponse {
    private int weekday;
}
