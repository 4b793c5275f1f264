package com.memehub.engagement.dto;

import lombok.Data;

import java.util.List;

@Data
public class MilestoneProgressDTO {
    private String track;
    private String name;
    private String description;
    private Long current;
    private List<Long> milestones;
    private Long nextMilestone;        // the last milestone once completed
    private Boolean completed;
    private Double progressPercentage; // from the previous milestone to the next, 0-100
}
