package com.couchapp.couch.dto.show.response;

import com.couchapp.couch.domain.show.Show;
import com.couchapp.couch.domain.show.ShowLifecycle;
import lombok.*;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShowResponse {

    private Long id;
    private Long catalogId;
    private String title;
    private String overview;
    private String posterPath;
    private List<String> genres;
    private Integer totalSeasons;
    private Integer totalEpisodes;
    private Integer episodeRuntime;
    private ShowLifecycle lifecycle;
    private Instant cachedAt;

    public static ShowResponse of(Show s) {
        return ShowResponse.builder()
                .id(s.getId())
                .catalogId(s.getCatalogId())
                .title(s.getTitle())
                .overview(s.getOverview())
                .posterPath(s.getPosterPath())
                .genres(List.copyOf(s.getGenres()))
                .totalSeasons(s.getTotalSeasons())
                .totalEpisodes(s.getTotalEpisodes())
                .episodeRuntime(s.getEpisodeRuntime())
                .lifecycle(s.getLifecycle())
                .cachedAt(s.getCachedAt())
                .build();
    }
}
