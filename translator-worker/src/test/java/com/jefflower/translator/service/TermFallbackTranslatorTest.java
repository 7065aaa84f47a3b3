package com.jefflower.translator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jefflower.translator.dto.LocalizedContent;
import com.jefflower.translator.enums.LanguageCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TermFallbackTranslator 单元测试
 */
class TermFallbackTranslatorTest {

    private TermFallbackTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new TermFallbackTranslator(Map.of(
                LanguageCode.RU, Map.of(
                        "ბინა", "Квартира",
                        "იყიდება", "Продается",
                        "ახალი რემონტი", "новый ремонт",
                        "რემონტი", "ремонт"),
                LanguageCode.EN, Map.of(
                        "ბინა", "Apartment")));
    }

    @Test
    @DisplayName("标题命中词典，描述为空时只返回标题")
    void translatesTitleOnly() {
        // when
        Optional<LocalizedContent> result = translator.translate("ბინა", null, LanguageCode.RU);

        // then
        assertThat(result).isPresent();
        assertThat(result.get().getTitle()).isEqualTo("Квартира");
        assertThat(result.get().getDescription()).isNull();
    }

    @Test
    @DisplayName("长词组优先替换")
    void prefersLongestPhrase() {
        // when
        Optional<LocalizedContent> result = translator.translate(
                "იყიდება ბინა", "ახალი რემონტი, ბინა", LanguageCode.RU);

        // then
        assertThat(result).isPresent();
        assertThat(result.get().getTitle()).isEqualTo("Продается Квартира");
        assertThat(result.get().getDescription()).isEqualTo("новый ремонт, Квартира");
    }

    @Test
    @DisplayName("文本中没有已知词组时不返回结果")
    void noRecognizedTerms() {
        // when
        Optional<LocalizedContent> result = translator.translate("სტუდიო", "ზღვის ხედი", LanguageCode.RU);

        // then
        assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("描述没有命中时描述字段为空")
    void descriptionUnmapped() {
        // when
        Optional<LocalizedContent> result = translator.translate("ბინა", "ზღვის ხედი", LanguageCode.EN);

        // then
        assertThat(result).isPresent();
        assertThat(result.get().getTitle()).isEqualTo("Apartment");
        assertThat(result.get().getDescription()).isNull();
    }

    @Test
    @DisplayName("没有词典的语言不返回结果")
    void languageWithoutDictionary() {
        TermFallbackTranslator enOnly = new TermFallbackTranslator(Map.of(LanguageCode.EN, Map.of("ბინა", "Apartment")));

        assertThat(enOnly.translate("ბინა", null, LanguageCode.RU)).isEmpty();
    }

    @Test
    @DisplayName("空文本不返回结果")
    void blankSource() {
        assertThat(translator.translate(null, "  ", LanguageCode.RU)).isEmpty();
    }

    @Test
    @DisplayName("从 classpath 加载默认词典")
    void loadsBundledDictionary() {
        // given
        TermFallbackTranslator bundled = new TermFallbackTranslator(
                new ObjectMapper(), new DefaultResourceLoader(), "classpath:fallback-terms.json");

        // when
        Optional<LocalizedContent> ru = bundled.translate("იყიდება 2 ოთახიანი ბინა", null, LanguageCode.RU);
        Optional<LocalizedContent> en = bundled.translate("ბინა", null, LanguageCode.EN);

        // then
        assertThat(ru).map(LocalizedContent::getTitle).contains("Продается 2 комнатная Квартира");
        assertThat(en).map(LocalizedContent::getTitle).contains("Apartment");
    }

    @Test
    @DisplayName("默认词典包含商业、设施等常用词")
    void bundledDictionaryCoversCommonTerms() {
        TermFallbackTranslator bundled = new TermFallbackTranslator(
                new ObjectMapper(), new DefaultResourceLoader(), "classpath:fallback-terms.json");

        assertThat(bundled.translate("ახალი ოფისი ცენტრი", "ლიფტი, ბალკონი, ინტერნეტი", LanguageCode.EN))
                .hasValueSatisfying(content -> {
                    assertThat(content.getTitle()).isEqualTo("New Office Center");
                    assertThat(content.getDescription()).isEqualTo("Elevator, Balcony, Internet");
                });
        assertThat(bundled.translate("3 ოთახი ზღვის ხედით", null, LanguageCode.RU))
                .map(LocalizedContent::getTitle).contains("3 Комната Море ხედით");
        assertThat(bundled.translate("მაღაზია და ავტოფარეხი", "ტელეფონი", LanguageCode.RU))
                .hasValueSatisfying(content -> {
                    assertThat(content.getTitle()).isEqualTo("Магазин და Гараж");
                    assertThat(content.getDescription()).isEqualTo("Телефон");
                });
        assertThat(bundled.translate("კომერციული", null, LanguageCode.EN))
                .map(LocalizedContent::getTitle).contains("Commercial");
    }

    @Test
    @DisplayName("词典文件不存在时启动失败")
    void missingDictionaryFails() {
        assertThatThrownBy(() -> new TermFallbackTranslator(
                new ObjectMapper(), new DefaultResourceLoader(), "classpath:missing-terms.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fallback dictionary");
    }
}
