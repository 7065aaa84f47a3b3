package com.jefflower.translator.dto;

import com.jefflower.translator.enums.LanguageCode;
import com.jefflower.translator.enums.TranslationOrigin;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一个房源所有目标语言的翻译结果汇总，按房源单独提交一次事务
 */
@ToString
@EqualsAndHashCode
public class PropertyUpdate {

    private final Long propertyId;
    private final Map<LanguageCode, TranslationResult> results;

    public PropertyUpdate(Long propertyId, List<TranslationResult> results) {
        this.propertyId = propertyId;
        Map<LanguageCode, TranslationResult> byLanguage = new EnumMap<>(LanguageCode.class);
        for (TranslationResult result : results) {
            byLanguage.put(result.getLanguage(), result);
        }
        this.results = Collections.unmodifiableMap(byLanguage);
    }

    public Long getPropertyId() {
        return propertyId;
    }

    /**
     * 所有语言的结果，包括 origin=NONE 的语言
     */
    public Map<LanguageCode, TranslationResult> getResults() {
        return results;
    }

    public Optional<TranslationResult> get(LanguageCode language) {
        return Optional.ofNullable(results.get(language));
    }

    /**
     * 需要写库的语言
     */
    public List<TranslationResult> writableResults() {
        return results.values().stream()
                .filter(TranslationResult::hasContent)
                .toList();
    }

    public boolean isEmpty() {
        return writableResults().isEmpty();
    }

    public boolean usedFallback() {
        return writableResults().stream()
                .anyMatch(result -> result.getOrigin() == TranslationOrigin.FALLBACK);
    }
}
