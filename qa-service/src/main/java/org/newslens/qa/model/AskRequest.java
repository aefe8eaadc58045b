package org.newslens.qa.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for {@code POST /api/chat/ask}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

    private String query;

    /** Optional, overrides {@code qa.default-top-k}. */
    @JsonProperty("top_k")
    private Integer topK;
}
