package com.deepansh.lineage.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DirectQueryRequest {

    @NotBlank(message = "query must not be blank")
    private String query;

    /** Upstream traversal depth for the top search hit */
    @Min(value = 1, message = "depth must be at least 1")
    @Max(value = 5, message = "depth must be at most 5")
    private int depth = 3;
}
