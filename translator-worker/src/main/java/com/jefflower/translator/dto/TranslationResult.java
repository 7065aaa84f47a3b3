package com.jefflower.translator.dto;

import com.jefflower.translator.enums.LanguageCode;
import com.jefflower.translator.enums.TranslationOrigin;
import lombok.Value;

/**
 * 单个 (房源, 语言) 的翻译结果。
 * 已填充的字段来自同一来源；NONE 时两个字段都为空。
 */
@Value
public class TranslationResult {
    LanguageCode language;
    String title;
    String description;
    TranslationOrigin origin;

    public static TranslationResult of(LanguageCode language, LocalizedContent content, TranslationOrigin origin) {
        return new TranslationResult(language, content.getTitle(), content.getDescription(), origin);
    }

    public static TranslationResult none(LanguageCode language) {
        return new TranslationResult(language, null, null, TranslationOrigin.NONE);
    }

    /**
     * 是否有需要写库的内容，空字符串不覆盖库里已有的值
     */
    public boolean hasContent() {
        return origin != TranslationOrigin.NONE && (hasTitle() || hasDescription());
    }

    public boolean hasTitle() {
        return title != null && !title.isEmpty();
    }

    public boolean hasDescription() {
        return description != null && !description.isEmpty();
    }
}
