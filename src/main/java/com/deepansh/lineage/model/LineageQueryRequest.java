package com.deepansh.lineage.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LineageQueryRequest {

    @NotBlank(message = "query must not be blank")
    private String query;

    @Min(value = 1, message = "maxSteps must be at least 1")
    @Max(value = 32, message = "maxSteps must be at most 32")
    private Integer maxSteps;

    @Min(value = 1, message = "maxTools must be at least 1")
    @Max(value = 10, message = "maxTools must be at most 10")
    private Integer maxTools;
}
