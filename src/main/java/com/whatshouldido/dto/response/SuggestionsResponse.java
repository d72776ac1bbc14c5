package com.whatshouldido.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 추천 응답. suggestions 와 route 중 하나만 채워진다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestionsResponse {
    private String intent;
    @JsonProperty("isPersonalized")
    private boolean personalized;
    private String userId;
    private List<SuggestionView> suggestions;
    private RouteView route;
    private Integer totalCount;
    private FilterInfo filters;
    private SuggestionMeta metadata;
}
