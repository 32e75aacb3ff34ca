package com.smartlists.externallist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of a TMDB response. User lists ({@code /list/{id}}) carry {@code items}; chart and
 * trending feeds carry {@code results}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TmdbPageResponse(
    @JsonProperty("items") List<Item> items,
    @JsonProperty("results") List<Item> results,
    @JsonProperty("total_pages") Integer totalPages
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(@JsonProperty("id") Integer id) {}
}
