package com.couchapp.couch.domain.show;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
        name = "tv_show",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_show_catalog_id", columnNames = {"catalog_id"})
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Show {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "catalog_id", nullable = false)
    private Long catalogId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 4000)
    private String overview;

    @Column(name = "poster_path", length = 200)
    private String posterPath;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "show_genre",
            joinColumns = @JoinColumn(name = "show_id")
    )
    @OrderColumn(name = "genre_index")
    @Column(name = "genre", nullable = false, length = 60)
    @Builder.Default
    private List<String> genres = new ArrayList<>();

    @Column(name = "total_seasons", nullable = false)
    private Integer totalSeasons;

    @Column(name = "total_episodes", nullable = false)
    private Integer totalEpisodes;

    @Column(name = "episode_runtime", nullable = false)
    private Integer episodeRuntime;

    @Enumerated(EnumType.STRING)
    @Column(name = "lifecycle", nullable = false, length = 10)
    private ShowLifecycle lifecycle;

    @Column(name = "catalog_status", length = 40)
    private String catalogStatus;

    @Column(name = "cached_at", nullable = false)
    private Instant cachedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        cachedAt = Instant.now();
        if (lifecycle == null) lifecycle = ShowLifecycle.fromCatalogStatus(catalogStatus);
    }

    public boolean isOngoing() {
        return lifecycle == ShowLifecycle.ONGOING;
    }

    public int runtimeMinutes() {
        return episodeRuntime == null ? 0 : episodeRuntime;
    }
}
