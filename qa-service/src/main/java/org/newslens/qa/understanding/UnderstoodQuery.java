package org.newslens.qa.understanding;

import org.newslens.model.ProcessedQuery;
import org.newslens.model.QueryAnalysis;

public record UnderstoodQuery(ProcessedQuery processed, QueryAnalysis analysis) {
}
