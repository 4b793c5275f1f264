package com.memehub.engagement.service;

import com.memehub.engagement.badge.UserStatistics;
import com.memehub.engagement.dto.MilestoneProgressDTO;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Progress towards the next milestone of each {@link MilestoneTrack}.
 *
 * Progress is measured from the previous milestone (or zero) to the next one.
 * Once the last milestone is reached the track reports it as next, at 100%.
 * Display only: milestones award no points.
 */
@Component
public class MilestonePolicy {

    public List<MilestoneProgressDTO> progress(UserStatistics statistics) {
        List<MilestoneProgressDTO> result = new ArrayList<>();
        for (MilestoneTrack track : MilestoneTrack.values()) {
            result.add(progress(track, statistics.valueOf(track.getCounter())));
        }
        return result;
    }

    public MilestoneProgressDTO progress(MilestoneTrack track, long current) {
        long[] milestones = track.getMilestones();
        MilestoneProgressDTO dto = new MilestoneProgressDTO();
        dto.setTrack(track.name());
        dto.setName(track.getDisplayName());
        dto.setDescription(track.getDescription());
        dto.setCurrent(current);
        dto.setMilestones(Arrays.stream(milestones).boxed().collect(Collectors.toList()));

        long previous = 0;
        for (long milestone : milestones) {
            if (current < milestone) {
                double percentage = (current - previous) * 100.0 / (milestone - previous);
                dto.setNextMilestone(milestone);
                dto.setCompleted(false);
                dto.setProgressPercentage(Math.round(Math.max(0.0, percentage) * 10) / 10.0);
                return dto;
            }
            previous = milestone;
        }
        dto.setNextMilestone(milestones[milestones.length - 1]);
        dto.setCompleted(true);
        dto.setProgressPercentage(100.0);
        return dto;
    }
}
