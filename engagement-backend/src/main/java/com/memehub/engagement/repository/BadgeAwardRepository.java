package com.memehub.engagement.repository;

import com.memehub.engagement.entity.BadgeAward;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BadgeAwardRepository extends JpaRepository<BadgeAward, Long> {

    List<BadgeAward> findByUserIdOrderByAwardedAtAsc(Long userId);

    long countByUserIdAndBadgeId(Long userId, Long badgeId);

    // Badge ids already held by a user
    @Query("SELECT a.badgeId FROM BadgeAward a WHERE a.userId = :userId")
    List<Long> findBadgeIdsByUserId(@Param("userId") Long userId);

    /**
     * 联查所有徽章定义，并 LEFT JOIN 统计持有人数
     * 索引顺序: [0:badge_key, 1:name, 2:category, 3:description, 4:holder_count]
     */
    @Query(value = "SELECT b.badge_key, b.name, b.category, b.description, COUNT(DISTINCT a.user_id) AS holder_count " +
                   "FROM badge b LEFT JOIN badge_award a ON b.badge_id = a.badge_id " +
                   "GROUP BY b.badge_key, b.name, b.category, b.description", nativeQuery = true)
    List<Object[]> findAllBadgesWithHolderCounts();
}
