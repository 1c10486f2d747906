package com.couchapp.couch.dto.show.request;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GetShowRequest {

    @NotNull
    private Long catalogId;

    // re-fetch from the catalog even when cached
    private boolean refresh;
}
