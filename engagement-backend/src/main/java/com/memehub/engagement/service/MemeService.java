package com.memehub.engagement.service;

import com.memehub.engagement.config.EngagementProperties;
import com.memehub.engagement.dto.MemeDTO;
import com.memehub.engagement.dto.MemeStatsDTO;
import com.memehub.engagement.entity.ActivityKind;
import com.memehub.engagement.entity.Meme;
import com.memehub.engagement.entity.PointReason;
import com.memehub.engagement.event.EngagementUpdateEvent;
import com.memehub.engagement.exception.InvalidReferenceException;
import com.memehub.engagement.exception.PolicyViolationException;
import com.memehub.engagement.repository.AppUserRepository;
import com.memehub.engagement.repository.MemeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class MemeService {

    private static final Logger log = LoggerFactory.getLogger(MemeService.class);

    private final MemeRepository memeRepository;
    private final AppUserRepository userRepository;
    private final PointsLedgerService ledgerService;
    private final ActivityLogService activityLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final EngagementProperties properties;
    private final Clock clock;

    public MemeService(MemeRepository memeRepository,
                       AppUserRepository userRepository,
                       PointsLedgerService ledgerService,
                       ActivityLogService activityLogService,
                       ApplicationEventPublisher eventPublisher,
                       EngagementProperties properties,
                       Clock clock) {
        this.memeRepository = memeRepository;
        this.userRepository = userRepository;
        this.ledgerService = ledgerService;
        this.activityLogService = activityLogService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Stores the meme and credits meme_created to its owner in one transaction.
     */
    @Transactional
    public MemeDTO createMeme(Long userId, String contentRef) {
        if (contentRef == null || contentRef.isBlank()) {
            throw new PolicyViolationException(PolicyViolationException.EMPTY_CONTENT, "Meme content reference is required");
        }
        String ref = contentRef.trim();
        if (ref.length() > Meme.CONTENT_REF_LENGTH) {
            throw new PolicyViolationException(PolicyViolationException.CONTENT_TOO_LONG,
                    "Meme content reference exceeds " + Meme.CONTENT_REF_LENGTH + " characters");
        }
        if (!userRepository.existsById(userId)) {
            throw new InvalidReferenceException(InvalidReferenceException.UNKNOWN_USER, "User " + userId + " does not exist");
        }
        Meme meme = memeRepository.saveAndFlush(new Meme(null, userId, ref, LocalDateTime.now(clock), 0, 0));

        String key = IdempotencyKeys.memeCreated(meme.getMemeId());
        ledgerService.record(PointEvent.of(userId, PointReason.MEME_CREATED, properties.getPoints().getMemeCreated(), key));
        activityLogService.append(userId, ActivityKind.MEME_CREATED, key);
        eventPublisher.publishEvent(new EngagementUpdateEvent(ActivityKind.MEME_CREATED, userId, meme.getMemeId(), key));

        log.info("User {} created meme {}", userId, meme.getMemeId());
        return MemeDTO.from(meme);
    }

    @Transactional(readOnly = true)
    public MemeDTO getMeme(Long memeId) {
        return MemeDTO.from(requireMeme(memeId));
    }

    @Transactional(readOnly = true)
    public MemeStatsDTO getMemeStats(Long memeId) {
        Meme meme = requireMeme(memeId);
        return new MemeStatsDTO(meme.getMemeId(), meme.getLikeCount(), meme.getCommentCount(),
                meme.getLikeCount() + meme.getCommentCount());
    }

    private Meme requireMeme(Long memeId) {
        return memeRepository.findById(memeId)
                .orElseThrow(() -> new InvalidReferenceException(InvalidReferenceException.UNKNOWN_MEME,
                        "Meme " + memeId + " does not exist"));
    }
}
