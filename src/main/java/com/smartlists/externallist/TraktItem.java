package com.smartlists.externallist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single entry of a Trakt list or chart endpoint. List and most chart entries nest the media under
 * {@code movie} or {@code show}; popular charts return the media object itself with {@code ids} on top.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TraktItem(
    @JsonProperty("movie") Media movie,
    @JsonProperty("show") Media show,
    @JsonProperty("ids") Ids ids
) {

    /**
     * @return identifiers from the nested movie, then the nested show, then the item itself
     */
    public Ids resolveIds() {
        if (movie != null && movie.ids() != null) return movie.ids();
        if (show != null && show.ids() != null) return show.ids();
        return ids;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Media(
        @JsonProperty("title") String title,
        @JsonProperty("year") Integer year,
        @JsonProperty("ids") Ids ids
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Ids(
        @JsonProperty("trakt") Integer trakt,
        @JsonProperty("slug") String slug,
        @JsonProperty("imdb") String imdb,
        @JsonProperty("tmdb") Integer tmdb,
        @JsonProperty("tvdb") Integer tvdb
    ) {}
}
