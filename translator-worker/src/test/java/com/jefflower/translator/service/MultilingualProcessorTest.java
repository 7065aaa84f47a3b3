package com.jefflower.translator.service;

import com.jefflower.translator.config.WorkerProperties;
import com.jefflower.translator.dto.LocalizedContent;
import com.jefflower.translator.dto.PropertyCandidate;
import com.jefflower.translator.dto.PropertyUpdate;
import com.jefflower.translator.dto.TranslationResult;
import com.jefflower.translator.enums.LanguageCode;
import com.jefflower.translator.enums.TranslationOrigin;
import com.jefflower.translator.exception.TranslationFetchException;
import com.jefflower.translator.exception.TranslationFetchException.FailureType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * MultilingualProcessor 单元测试
 */
@ExtendWith(MockitoExtension.class)
class MultilingualProcessorTest {

    @Mock
    private ListingApiClient listingApiClient;

    private ShutdownSignal shutdownSignal;
    private MultilingualProcessor processor;
    private PropertyCandidate candidate;

    @BeforeEach
    void setUp() {
        WorkerProperties workerProperties = new WorkerProperties();
        workerProperties.setLanguages(List.of(LanguageCode.EN, LanguageCode.RU));
        TermFallbackTranslator fallbackTranslator = new TermFallbackTranslator(Map.of(
                LanguageCode.RU, Map.of("ბინა", "Квартира")));
        shutdownSignal = new ShutdownSignal();
        processor = new MultilingualProcessor(listingApiClient, fallbackTranslator, workerProperties, shutdownSignal);

        candidate = PropertyCandidate.builder()
                .id(7L)
                .externalId("20246666")
                .sourceTitle("ბინა")
                .build();
    }

    private static TranslationFetchException failure(FailureType type, LanguageCode language) {
        return new TranslationFetchException(type, "20246666", language, "stubbed");
    }

    @Test
    @DisplayName("英语走接口，俄语接口失败后使用词典兜底")
    void apiAndFallbackScenario() {
        // given
        when(listingApiClient.fetch("20246666", LanguageCode.EN))
                .thenReturn(LocalizedContent.of("Apartment", "Nice flat"));
        when(listingApiClient.fetch("20246666", LanguageCode.RU))
                .thenThrow(failure(FailureType.TRANSIENT, LanguageCode.RU));

        // when
        PropertyUpdate update = processor.process(candidate);

        // then
        TranslationResult en = update.get(LanguageCode.EN).orElseThrow();
        assertThat(en.getTitle()).isEqualTo("Apartment");
        assertThat(en.getDescription()).isEqualTo("Nice flat");
        assertThat(en.getOrigin()).isEqualTo(TranslationOrigin.API);

        TranslationResult ru = update.get(LanguageCode.RU).orElseThrow();
        assertThat(ru.getTitle()).isEqualTo("Квартира");
        assertThat(ru.getDescription()).isNull();
        assertThat(ru.getOrigin()).isEqualTo(TranslationOrigin.FALLBACK);

        assertThat(update.getPropertyId()).isEqualTo(7L);
        assertThat(update.usedFallback()).isTrue();
        assertThat(update.writableResults()).hasSize(2);
    }

    @Test
    @DisplayName("接口失败且词典无匹配时省略该语言")
    void omitsLanguageWithoutFallback() {
        // given
        PropertyCandidate unknownTerms = PropertyCandidate.builder()
                .id(8L).externalId("20246666").sourceTitle("სტუდიო").build();
        when(listingApiClient.fetch("20246666", LanguageCode.EN))
                .thenReturn(LocalizedContent.of("Studio", "Sea view"));
        when(listingApiClient.fetch("20246666", LanguageCode.RU))
                .thenThrow(failure(FailureType.NOT_FOUND, LanguageCode.RU));

        // when
        PropertyUpdate update = processor.process(unknownTerms);

        // then
        assertThat(update.get(LanguageCode.RU)).map(TranslationResult::getOrigin).contains(TranslationOrigin.NONE);
        assertThat(update.writableResults())
                .extracting(TranslationResult::getLanguage)
                .containsExactly(LanguageCode.EN);
        assertThat(update.usedFallback()).isFalse();
    }

    @Test
    @DisplayName("所有语言都失败且无兜底时结果为空")
    void allLanguagesFail() {
        PropertyCandidate unknownTerms = PropertyCandidate.builder()
                .id(9L).externalId("20246666").sourceTitle("სტუდიო").build();
        when(listingApiClient.fetch(any(), any())).thenThrow(failure(FailureType.AUTH_ERROR, LanguageCode.EN));

        PropertyUpdate update = processor.process(unknownTerms);

        assertThat(update.isEmpty()).isTrue();
        assertThat(update.getResults()).hasSize(2);
    }

    @Test
    @DisplayName("接口返回相同内容时两次处理结果一致")
    void processIsIdempotent() {
        when(listingApiClient.fetch("20246666", LanguageCode.EN))
                .thenReturn(LocalizedContent.of("Apartment", "Nice flat"));
        when(listingApiClient.fetch("20246666", LanguageCode.RU))
                .thenReturn(LocalizedContent.of("Квартира", "Хорошая квартира"));

        PropertyUpdate first = processor.process(candidate);
        PropertyUpdate second = processor.process(candidate);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("接口返回空字符串时不走兜底，也不写库")
    void emptyApiResultIsNotWritten() {
        when(listingApiClient.fetch("20246666", LanguageCode.EN))
                .thenReturn(LocalizedContent.of("", ""));
        when(listingApiClient.fetch("20246666", LanguageCode.RU))
                .thenReturn(LocalizedContent.of("Квартира", ""));

        PropertyUpdate update = processor.process(candidate);

        assertThat(update.get(LanguageCode.EN)).map(TranslationResult::getOrigin).contains(TranslationOrigin.API);
        assertThat(update.writableResults())
                .extracting(TranslationResult::getLanguage)
                .containsExactly(LanguageCode.RU);
    }

    @Test
    @DisplayName("关闭过程中接口失败不写兜底内容")
    void noFallbackDuringShutdown() {
        shutdownSignal.signal();
        when(listingApiClient.fetch(any(), any())).thenThrow(failure(FailureType.TRANSIENT, LanguageCode.RU));

        PropertyUpdate update = processor.process(candidate);

        assertThat(update.isEmpty()).isTrue();
        assertThat(update.getResults()).hasSize(2);
    }
}
