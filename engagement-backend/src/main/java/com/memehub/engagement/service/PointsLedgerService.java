package com.memehub.engagement.service;

import com.memehub.engagement.config.EngagementProperties;
import com.memehub.engagement.dto.PointTransactionDTO;
import com.memehub.engagement.entity.ActivityKind;
import com.memehub.engagement.entity.AppUser;
import com.memehub.engagement.entity.PointReason;
import com.memehub.engagement.entity.PointTransaction;
import com.memehub.engagement.entity.Rank;
import com.memehub.engagement.event.EngagementUpdateEvent;
import com.memehub.engagement.event.RankChangedEvent;
import com.memehub.engagement.exception.DuplicateActionException;
import com.memehub.engagement.exception.InvalidReferenceException;
import com.memehub.engagement.exception.PolicyViolationException;
import com.memehub.engagement.repository.AppUserRepository;
import com.memehub.engagement.repository.PointTransactionRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 【PointsLedgerService】
 * Records point events in the ledger and keeps each user's balance and rank
 * in step with it.
 *
 * record() locks the user row, checks the idempotency key, inserts the
 * ledger row and recomputes total_points as the ledger sum, all in one
 * transaction. The same key recorded again returns the existing row untouched.
 */
@Service
public class PointsLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PointsLedgerService.class);

    private final PointTransactionRepository transactionRepository;
    private final AppUserRepository userRepository;
    private final RankPolicy rankPolicy;
    private final ActivityLogService activityLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final EngagementProperties properties;
    private final Clock clock;

    public PointsLedgerService(PointTransactionRepository transactionRepository,
                               AppUserRepository userRepository,
                               RankPolicy rankPolicy,
                               ActivityLogService activityLogService,
                               ApplicationEventPublisher eventPublisher,
                               EngagementProperties properties,
                               Clock clock) {
        this.transactionRepository = transactionRepository;
        this.userRepository = userRepository;
        this.rankPolicy = rankPolicy;
        this.activityLogService = activityLogService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Applies a point event at most once per idempotency key.
     *
     * @throws InvalidReferenceException if the user does not exist
     * @throws DuplicateActionException if the key is already used by another user
     * @throws PolicyViolationException if the key or note does not fit the ledger columns
     */
    @Transactional
    public LedgerResult record(PointEvent event) {
        checkLength(event.getIdempotencyKey(), PointTransaction.IDEMPOTENCY_KEY_LENGTH,
                PolicyViolationException.KEY_TOO_LONG, "Idempotency key");
        checkLength(event.getNote(), PointTransaction.NOTE_LENGTH, PolicyViolationException.NOTE_TOO_LONG, "Ledger note");
        AppUser user = userRepository.findByIdForUpdate(event.getUserId())
                .orElseThrow(() -> new InvalidReferenceException(InvalidReferenceException.UNKNOWN_USER,
                        "User " + event.getUserId() + " does not exist"));

        Optional<PointTransaction> existing = transactionRepository.findByIdempotencyKey(event.getIdempotencyKey());
        if (existing.isPresent()) {
            PointTransaction tx = existing.get();
            if (!tx.getUserId().equals(user.getUserId())) {
                throw new DuplicateActionException(DuplicateActionException.DUPLICATE_KEY,
                        "Idempotency key " + event.getIdempotencyKey() + " belongs to another user");
            }
            log.debug("Ledger key {} already recorded as transaction {}, skipping", tx.getIdempotencyKey(), tx.getTransactionId());
            return new LedgerResult(tx, false, user.getRank(), user.getRank(), user.getTotalPoints());
        }

        PointTransaction tx = new PointTransaction(null, user.getUserId(), event.getAmount(), event.getReason(),
                event.getIdempotencyKey(), event.getNote(), LocalDateTime.now(clock));
        try {
            tx = transactionRepository.saveAndFlush(tx);
        } catch (DataIntegrityViolationException e) {
            if (!isConstraintViolation(e)) {
                throw e;
            }
            throw new DuplicateActionException(DuplicateActionException.DUPLICATE_KEY,
                    "Idempotency key " + event.getIdempotencyKey() + " was recorded concurrently", e);
        }

        long total = transactionRepository.sumAmountByUserId(user.getUserId());
        Rank previousRank = user.getRank();
        Rank rank = rankPolicy.rankFor(total);
        user.setTotalPoints(total);
        user.setRank(rank);

        if (rank != previousRank) {
            log.info("User {} rank changed {} -> {} at {} points", user.getUserId(), previousRank, rank, total);
            activityLogService.append(user.getUserId(), ActivityKind.RANK_CHANGED, "rank:" + rank.name());
            eventPublisher.publishEvent(new RankChangedEvent(user.getUserId(), previousRank, rank, total));
        }
        log.debug("Recorded {} {} for user {} (key {}), total {}", event.getReason(), event.getAmount(),
                user.getUserId(), event.getIdempotencyKey(), total);
        return new LedgerResult(tx, true, previousRank, rank, total);
    }

    /**
     * +1 once per calendar day (engagement.zone). A second login on the same
     * day is a no-op with applied=false.
     */
    @Transactional
    public LedgerResult recordDailyLogin(Long userId) {
        LocalDate today = LocalDate.now(clock);
        LedgerResult result = record(PointEvent.of(userId, PointReason.DAILY_LOGIN,
                properties.getPoints().getDailyLogin(), IdempotencyKeys.dailyLogin(userId, today)));
        if (result.isApplied()) {
            activityLogService.append(userId, ActivityKind.DAILY_LOGIN, "login:" + today);
            eventPublisher.publishEvent(new EngagementUpdateEvent(ActivityKind.DAILY_LOGIN, userId, null, "login:" + today));
        }
        return result;
    }

    /**
     * Caller-specified bonus inside [engagement.bonus.min, engagement.bonus.max].
     * The grantor and note go into the ledger note and the activity trail.
     */
    @Transactional
    public LedgerResult grantBonus(Long userId, Integer amount, String callerKey, Long grantedBy, String note) {
        int min = properties.getBonus().getMin();
        int max = properties.getBonus().getMax();
        if (amount == null || amount < min || amount > max) {
            throw new PolicyViolationException(PolicyViolationException.BONUS_OUT_OF_RANGE,
                    "Bonus must be between " + min + " and " + max + " points, got " + amount);
        }
        if (callerKey == null || callerKey.isBlank()) {
            throw new IllegalArgumentException("Bonus requires an idempotency key");
        }
        String auditNote = "granted by " + grantedBy + (note == null || note.isBlank() ? "" : ": " + note.trim());
        String key = IdempotencyKeys.bonus(callerKey.trim());
        LedgerResult result = record(new PointEvent(userId, PointReason.BONUS, amount, key, auditNote));
        if (result.isApplied()) {
            log.info("Bonus of {} points granted to user {} by {}", amount, userId, grantedBy);
            activityLogService.append(userId, ActivityKind.BONUS_GRANTED, key);
            eventPublisher.publishEvent(new EngagementUpdateEvent(ActivityKind.BONUS_GRANTED, userId, null, key));
        }
        return result;
    }

    /**
     * The ledger entry recorded under a key, if any.
     */
    @Transactional(readOnly = true)
    public Optional<PointTransaction> findByKey(String idempotencyKey) {
        return transactionRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Transactional(readOnly = true)
    public List<PointTransactionDTO> history(Long userId) {
        return transactionRepository.findByUserIdOrderByCreatedAtDescTransactionIdDesc(userId).stream()
                .map(PointTransactionDTO::from)
                .collect(Collectors.toList());
    }

    /**
     * @return true if the stored balance equals the ledger sum
     */
    @Transactional(readOnly = true)
    public boolean reconcile(Long userId) {
        AppUser user = userRepository.findById(userId)
                .orElseThrow(() -> new InvalidReferenceException(InvalidReferenceException.UNKNOWN_USER,
                        "User " + userId + " does not exist"));
        long ledgerSum = transactionRepository.sumAmountByUserId(userId);
        if (ledgerSum != user.getTotalPoints()) {
            log.warn("Balance mismatch for user {}: stored {} but ledger sums to {}", userId, user.getTotalPoints(), ledgerSum);
            return false;
        }
        return true;
    }

    /**
     * 积分规则表, for display
     */
    public Map<String, Integer> pointTable() {
        EngagementProperties.Points points = properties.getPoints();
        Map<String, Integer> table = new LinkedHashMap<>();
        table.put(PointReason.MEME_CREATED.name(), points.getMemeCreated());
        table.put(PointReason.LIKE_RECEIVED.name(), points.getLikeReceived());
        table.put(PointReason.COMMENT_MADE.name(), points.getCommentMade());
        table.put(PointReason.DAILY_LOGIN.name(), points.getDailyLogin());
        table.put(PointReason.BONUS.name() + "_MIN", properties.getBonus().getMin());
        table.put(PointReason.BONUS.name() + "_MAX", properties.getBonus().getMax());
        table.put(PointReason.LIKE_REMOVED_REVERSAL.name(), -points.getLikeReceived());
        return table;
    }

    private void checkLength(String value, int max, String reason, String what) {
        if (value != null && value.length() > max) {
            throw new PolicyViolationException(reason, what + " exceeds " + max + " characters");
        }
    }

    // unique key hit, as opposed to a value the column cannot hold
    private static boolean isConstraintViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException) {
                return true;
            }
        }
        return false;
    }
}
