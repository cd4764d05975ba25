package com.deepansh.lineage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DirectQueryResponse {

    private String query;
    private String answer;

    @Builder.Default
    private List<Map<String, Object>> contextDocs = new ArrayList<>();

    private Map<String, Object> lineagePath;
    private double confidence;
}
