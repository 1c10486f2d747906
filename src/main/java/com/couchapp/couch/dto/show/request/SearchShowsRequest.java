package com.couchapp.couch.dto.show.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SearchShowsRequest {
    @NotBlank @Size(min = 2, max = 200) private String query;
}
