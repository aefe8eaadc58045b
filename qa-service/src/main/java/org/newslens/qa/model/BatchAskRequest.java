package org.newslens.qa.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for {@code POST /api/chat/ask/batch}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchAskRequest {

    private List<String> queries;
}
