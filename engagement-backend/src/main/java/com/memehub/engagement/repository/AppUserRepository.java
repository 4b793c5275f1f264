package com.memehub.engagement.repository;

import com.memehub.engagement.entity.AppUser;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    /**
     * SELECT ... FOR UPDATE on the user row. Every ledger write for a user
     * goes through this lock, which serialises writers of the same balance.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM AppUser u WHERE u.userId = :userId")
    Optional<AppUser> findByIdForUpdate(@Param("userId") Long userId);

    // Leaderboard page: points desc, earlier account first, then id
    @Query(value = "SELECT * FROM app_user u " +
                   "ORDER BY u.total_points DESC, u.created_at ASC, u.user_id ASC " +
                   "LIMIT :limit OFFSET :offset", nativeQuery = true)
    List<AppUser> findLeaderboardPage(@Param("limit") int limit, @Param("offset") int offset);

    // Number of users ranked strictly ahead of the given (points, created_at, id)
    @Query("SELECT COUNT(u) FROM AppUser u WHERE u.totalPoints > :points " +
           "OR (u.totalPoints = :points AND u.createdAt < :createdAt) " +
           "OR (u.totalPoints = :points AND u.createdAt = :createdAt AND u.userId < :userId)")
    long countRankedAhead(@Param("points") Long points,
                          @Param("createdAt") LocalDateTime createdAt,
                          @Param("userId") Long userId);
}
