package com.smartlists.externallist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wrapper shape of the MDBList list items endpoint, with separate movie and show arrays.
 * Some endpoints return a bare array of {@link Item} instead.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MdbListResponse(
    @JsonProperty("movies") List<Item> movies,
    @JsonProperty("shows") List<Item> shows
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
        @JsonProperty("imdb_id") String imdbId,
        @JsonProperty("tvdb_id") Integer tvdbId,
        @JsonProperty("ids") Ids ids
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Ids(
        @JsonProperty("imdb") String imdb,
        @JsonProperty("tmdb") Integer tmdb,
        @JsonProperty("tvdb") Integer tvdb
    ) {}
}
