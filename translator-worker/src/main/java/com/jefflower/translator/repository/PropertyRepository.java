package com.jefflower.translator.repository;

import com.jefflower.translator.entity.Property;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface PropertyRepository extends JpaRepository<Property, Long>, PropertyRepositoryCustom {
    Optional<Property> findByExternalId(String externalId);

    @Modifying
    @Query("UPDATE Property p SET p.translationAttemptedAt = :attemptedAt WHERE p.id = :id")
    int markAttempted(@Param("id") Long id, @Param("attemptedAt") LocalDateTime attemptedAt);
}
