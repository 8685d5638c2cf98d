package com.foodtrace.types.exception;

import com.foodtrace.types.common.GraphValidationIssue;
import com.foodtrace.types.enums.ResponseCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Publishing was refused because the graph has structural issues. Carries the complete list.
 */
@Getter
public class GraphInvalidException extends AppException {

    private final List<GraphValidationIssue> issues;

    public GraphInvalidException(List<GraphValidationIssue> issues) {
        super(ResponseCode.GRAPH_INVALID, describe(issues));
        this.issues = issues == null ? List.of() : List.copyOf(issues);
    }

    private static String describe(List<GraphValidationIssue> issues) {
        if (issues == null || issues.isEmpty()) {
            return ResponseCode.GRAPH_INVALID.getInfo();
        }
        return ResponseCode.GRAPH_INVALID.getInfo() + ": " + issues.stream()
                .map(GraphValidationIssue::toString)
                .collect(Collectors.joining("; "));
    }
}
