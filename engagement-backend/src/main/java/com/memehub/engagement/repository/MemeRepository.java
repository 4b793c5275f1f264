package com.memehub.engagement.repository;

import com.memehub.engagement.entity.Meme;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MemeRepository extends JpaRepository<Meme, Long> {

    // Locks the meme row; interactions on one meme are serialised by it
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Meme m WHERE m.memeId = :memeId")
    Optional<Meme> findByIdForUpdate(@Param("memeId") Long memeId);

    long countByOwnerId(Long ownerId);

    List<Meme> findByOwnerIdOrderByCreatedAtDescMemeIdDesc(Long ownerId);
}
