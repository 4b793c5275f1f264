package com.memehub.engagement.repository;

import com.memehub.engagement.entity.MemeComment;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface MemeCommentRepository extends JpaRepository<MemeComment, Long> {

    long countByMemeId(Long memeId);

    long countByAuthorId(Long authorId);

    List<MemeComment> findByMemeIdOrderByCreatedAtDescCommentIdDesc(Long memeId, Pageable pageable);

    /**
     * Per-meme comment counts inside (since, until].
     * @return [0:meme_id, 1:comment_count]
     */
    @Query("SELECT c.memeId, COUNT(c) FROM MemeComment c " +
           "WHERE c.createdAt > :since AND c.createdAt <= :until GROUP BY c.memeId")
    List<Object[]> countByMemeCreatedBetween(@Param("since") LocalDateTime since,
                                             @Param("until") LocalDateTime until);
}
