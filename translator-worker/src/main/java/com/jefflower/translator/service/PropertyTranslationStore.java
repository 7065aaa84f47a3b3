package com.jefflower.translator.service;

import com.jefflower.translator.config.WorkerProperties;
import com.jefflower.translator.dto.PropertyCandidate;
import com.jefflower.translator.dto.PropertyUpdate;
import com.jefflower.translator.dto.TranslationResult;
import com.jefflower.translator.entity.Property;
import com.jefflower.translator.exception.PersistenceFailureException;
import com.jefflower.translator.repository.PropertyRepository;
import jakarta.persistence.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 房源翻译字段的读写，每个房源的写入是独立事务
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PropertyTranslationStore {

    private final PropertyRepository propertyRepository;
    private final WorkerProperties workerProperties;

    @Transactional(readOnly = true)
    public List<PropertyCandidate> findCandidates(int limit) {
        return propertyRepository.findCandidates(limit, workerProperties.getLanguages()).stream()
                .map(PropertyCandidate::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return propertyRepository.countCandidates(workerProperties.getLanguages());
    }

    @Transactional(readOnly = true)
    public Optional<PropertyCandidate> findByExternalId(String externalId) {
        return propertyRepository.findByExternalId(externalId).map(PropertyCandidate::from);
    }

    /**
     * 只写入 update 中有内容的语言字段；失败时整个事务回滚，不在这里重试
     */
    @Transactional
    public void applyUpdate(Long candidateId, PropertyUpdate update) {
        try {
            Property property = propertyRepository.findById(candidateId)
                    .orElseThrow(() -> new PersistenceFailureException(candidateId, "property no longer exists", null));

            LocalDateTime now = LocalDateTime.now();
            for (TranslationResult result : update.writableResults()) {
                if (result.hasTitle()) {
                    property.setLocalizedTitle(result.getLanguage(), result.getTitle());
                }
                if (result.hasDescription()) {
                    property.setLocalizedDescription(result.getLanguage(), result.getDescription());
                }
            }
            property.setTranslationAttemptedAt(now);
            if (!update.isEmpty()) {
                property.setTranslatedAt(now);
            }
            propertyRepository.saveAndFlush(property);
            log.debug("Property {} updated: languages={}", candidateId,
                    update.writableResults().stream().map(r -> r.getLanguage().getCode()).toList());
        } catch (DataAccessException | PersistenceException e) {
            throw new PersistenceFailureException(candidateId, e.getMessage(), e);
        }
    }

    /**
     * 没有任何可写内容时只记录尝试时间，让该房源排到后面
     */
    @Transactional
    public void recordAttempt(Long candidateId) {
        try {
            propertyRepository.markAttempted(candidateId, LocalDateTime.now());
        } catch (DataAccessException | PersistenceException e) {
            throw new PersistenceFailureException(candidateId, e.getMessage(), e);
        }
    }
}
