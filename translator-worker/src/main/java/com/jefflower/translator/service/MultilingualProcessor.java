package com.jefflower.translator.service;

import com.jefflower.translator.config.WorkerProperties;
import com.jefflower.translator.dto.LocalizedContent;
import com.jefflower.translator.dto.PropertyCandidate;
import com.jefflower.translator.dto.PropertyUpdate;
import com.jefflower.translator.dto.TranslationResult;
import com.jefflower.translator.enums.LanguageCode;
import com.jefflower.translator.enums.TranslationOrigin;
import com.jefflower.translator.exception.TranslationFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * 处理单个房源：逐个语言调用接口，失败时走词典兜底，汇总成一次写库的 PropertyUpdate。
 * 本身不做任何 I/O。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MultilingualProcessor {

    private final ListingApiClient listingApiClient;
    private final TermFallbackTranslator fallbackTranslator;
    private final WorkerProperties workerProperties;
    private final ShutdownSignal shutdownSignal;

    public PropertyUpdate process(PropertyCandidate candidate) {
        List<TranslationResult> results = new ArrayList<>();
        for (LanguageCode language : new LinkedHashSet<>(workerProperties.getLanguages())) {
            results.add(translate(candidate, language));
        }
        return new PropertyUpdate(candidate.getId(), results);
    }

    private TranslationResult translate(PropertyCandidate candidate, LanguageCode language) {
        try {
            LocalizedContent content = listingApiClient.fetch(candidate.getExternalId(), language);
            return TranslationResult.of(language, content, TranslationOrigin.API);
        } catch (TranslationFetchException e) {
            log.warn("Listing API failed for property {} [{}]: {}",
                    candidate.getExternalId(), language.getCode(), e.getMessage());
        }

        // 关闭过程中的失败不是接口故障，不写兜底内容
        if (shutdownSignal.isSignalled()) {
            return TranslationResult.none(language);
        }

        Optional<LocalizedContent> fallback = fallbackTranslator.translate(
                candidate.getSourceTitle(), candidate.getSourceDescription(), language);
        if (fallback.isPresent()) {
            log.warn("Using fallback dictionary for property {} [{}]", candidate.getExternalId(), language.getCode());
            return TranslationResult.of(language, fallback.get(), TranslationOrigin.FALLBACK);
        }

        log.info("No translation available for property {} [{}], leaving columns untouched",
                candidate.getExternalId(), language.getCode());
        return TranslationResult.none(language);
    }
}
