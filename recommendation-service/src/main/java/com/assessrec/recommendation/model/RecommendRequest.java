package com.assessrec.recommendation.model;

import lombok.Data;

@Data
public class RecommendRequest {
    private String query;
}
