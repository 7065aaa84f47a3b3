package com.jefflower.translator.repository;

import com.jefflower.translator.entity.TranslationCycleLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TranslationCycleLogRepository extends JpaRepository<TranslationCycleLog, Long> {
    Page<TranslationCycleLog> findAllByOrderByStartTimeDesc(Pageable pageable);
}
