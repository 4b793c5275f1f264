package com.memehub.engagement.repository;

import com.memehub.engagement.entity.MemeLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface MemeLikeRepository extends JpaRepository<MemeLike, Long> {

    boolean existsByUserIdAndMemeId(Long userId, Long memeId);

    Optional<MemeLike> findByUserIdAndMemeId(Long userId, Long memeId);

    long countByMemeId(Long memeId);

    // Likes currently held by all memes of one owner
    @Query("SELECT COUNT(l) FROM MemeLike l, Meme m WHERE l.memeId = m.memeId AND m.ownerId = :ownerId")
    long countLikesReceivedByOwner(@Param("ownerId") Long ownerId);

    /**
     * Per-meme like counts inside (since, until].
     * @return [0:meme_id, 1:like_count]
     */
    @Query("SELECT l.memeId, COUNT(l) FROM MemeLike l " +
           "WHERE l.createdAt > :since AND l.createdAt <= :until GROUP BY l.memeId")
    List<Object[]> countByMemeCreatedBetween(@Param("since") LocalDateTime since,
                                             @Param("until") LocalDateTime until);
}
