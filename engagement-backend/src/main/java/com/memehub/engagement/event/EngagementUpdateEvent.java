package com.memehub.engagement.event;

import com.memehub.engagement.entity.ActivityKind;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Published inside the writing transaction; listeners only see it after commit.
 */
@Getter
@ToString
@AllArgsConstructor
public class EngagementUpdateEvent {

    private final ActivityKind kind;
    private final Long userId;
    /** null for events that are not about a meme (login, bonus) */
    private final Long memeId;
    private final String reference;
}
