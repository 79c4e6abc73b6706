package io.relay.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResearchSource(String url, String title, String query) {

    public static ResearchSource ofQuery(String query) {
        return new ResearchSource(null, null, query);
    }

    public static ResearchSource ofPage(String url, String title) {
        return new ResearchSource(url, title, null);
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
