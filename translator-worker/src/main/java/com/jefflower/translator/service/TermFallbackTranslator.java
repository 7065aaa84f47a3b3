package com.jefflower.translator.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jefflower.translator.dto.LocalizedContent;
import com.jefflower.translator.enums.LanguageCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 接口不可用时的兜底翻译：按固定词典把源语言（格鲁吉亚语）词组替换成目标语言。
 * 只做替换，文本里没有已知词组时不返回结果。
 */
@Slf4j
@Service
public class TermFallbackTranslator {

    private static final TypeReference<Map<String, Map<String, String>>> DICTIONARY_TYPE = new TypeReference<>() {
    };

    private final Map<LanguageCode, TermDictionary> dictionaries;

    @Autowired
    public TermFallbackTranslator(ObjectMapper objectMapper, ResourceLoader resourceLoader,
                                  @Value("${translator.fallback.dictionary:classpath:fallback-terms.json}") String location) {
        this(loadDictionary(objectMapper, resourceLoader.getResource(location)));
    }

    public TermFallbackTranslator(Map<LanguageCode, Map<String, String>> terms) {
        Map<LanguageCode, TermDictionary> compiled = new EnumMap<>(LanguageCode.class);
        terms.forEach((language, mapping) -> {
            if (!mapping.isEmpty()) {
                compiled.put(language, new TermDictionary(mapping));
            }
        });
        this.dictionaries = Collections.unmodifiableMap(compiled);
        log.info("Fallback dictionary loaded: {}", compiled.entrySet().stream()
                .collect(Collectors.toMap(e -> e.getKey().getCode(), e -> e.getValue().size())));
    }

    public Optional<LocalizedContent> translate(String sourceTitle, String sourceDescription, LanguageCode language) {
        TermDictionary dictionary = dictionaries.get(language);
        if (dictionary == null) {
            return Optional.empty();
        }
        String title = dictionary.substitute(sourceTitle);
        String description = dictionary.substitute(sourceDescription);
        if (title == null && description == null) {
            return Optional.empty();
        }
        return Optional.of(LocalizedContent.of(title, description));
    }

    private static Map<LanguageCode, Map<String, String>> loadDictionary(ObjectMapper objectMapper, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            Map<String, Map<String, String>> raw = objectMapper.readValue(in, DICTIONARY_TYPE);
            Map<LanguageCode, Map<String, String>> terms = new EnumMap<>(LanguageCode.class);
            raw.forEach((code, mapping) -> terms.put(LanguageCode.fromCode(code), mapping));
            return terms;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load fallback dictionary from " + resource.getDescription(), e);
        }
    }

    /**
     * 单一语言的词典，长词组优先匹配，一次扫描完成替换
     */
    private static final class TermDictionary {
        private final Map<String, String> terms;
        private final Pattern pattern;

        TermDictionary(Map<String, String> mapping) {
            Map<String, String> copy = new LinkedHashMap<>();
            mapping.forEach((source, target) -> {
                if (source != null && !source.isBlank() && target != null) {
                    copy.put(source.trim(), target);
                }
            });
            this.terms = Collections.unmodifiableMap(copy);
            this.pattern = Pattern.compile(copy.keySet().stream()
                    .sorted(Comparator.comparingInt(String::length).reversed())
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|")));
        }

        int size() {
            return terms.size();
        }

        String substitute(String text) {
            if (text == null || text.isBlank() || terms.isEmpty()) {
                return null;
            }
            Matcher matcher = pattern.matcher(text);
            StringBuilder sb = new StringBuilder();
            boolean matched = false;
            while (matcher.find()) {
                matched = true;
                matcher.appendReplacement(sb, Matcher.quoteReplacement(terms.get(matcher.group())));
            }
            if (!matched) {
                return null;
            }
            matcher.appendTail(sb);
            return sb.toString().trim();
        }
    }
}
