package com.jefflower.translator.repository;

import com.jefflower.translator.entity.Property;
import com.jefflower.translator.enums.LanguageCode;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public class PropertyRepositoryImpl implements PropertyRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Property> findCandidates(int limit, Collection<LanguageCode> languages) {
        if (limit <= 0 || languages.isEmpty()) {
            return List.of();
        }
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Property> query = cb.createQuery(Property.class);
        Root<Property> root = query.from(Property.class);
        Expression<LocalDateTime> attemptedAt = root.get("translationAttemptedAt");

        query.select(root)
                .where(isCandidate(cb, root, languages))
                .orderBy(
                        cb.asc(cb.<Integer>selectCase().when(cb.isNull(attemptedAt), 0).otherwise(1)),
                        cb.asc(attemptedAt),
                        cb.asc(root.get("id")));

        return entityManager.createQuery(query)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    public long countCandidates(Collection<LanguageCode> languages) {
        if (languages.isEmpty()) {
            return 0;
        }
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<Property> root = query.from(Property.class);
        query.select(cb.count(root)).where(isCandidate(cb, root, languages));
        return entityManager.createQuery(query).getSingleResult();
    }

    /**
     * 有外部 id 和源标题，且至少一种语言缺少翻译
     */
    private Predicate isCandidate(CriteriaBuilder cb, Root<Property> root, Collection<LanguageCode> languages) {
        return cb.and(
                cb.isNotNull(root.get("externalId")),
                cb.isNotNull(root.get("title")),
                missingTranslation(cb, root, languages));
    }

    private Predicate missingTranslation(CriteriaBuilder cb, Root<Property> root, Collection<LanguageCode> languages) {
        Predicate[] perLanguage = languages.stream()
                .distinct()
                .map(lang -> cb.or(
                        isBlank(cb, root.get(lang.getTitleAttribute())),
                        isBlank(cb, root.get(lang.getDescriptionAttribute()))))
                .toArray(Predicate[]::new);
        return cb.or(perLanguage);
    }

    private Predicate isBlank(CriteriaBuilder cb, Expression<String> column) {
        return cb.or(cb.isNull(column), cb.equal(cb.trim(column), ""));
    }
}
