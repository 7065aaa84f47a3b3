package com.jefflower.translator.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 目标语言。每种语言对应 Property 实体上的一对标题/描述字段，
 * 新增语言时同时新增枚举值和两列。
 */
public enum LanguageCode {
    EN("en", "titleEn", "descriptionEn"),
    RU("ru", "titleRu", "descriptionRu");

    private final String code;
    private final String titleAttribute;
    private final String descriptionAttribute;

    LanguageCode(String code, String titleAttribute, String descriptionAttribute) {
        this.code = code;
        this.titleAttribute = titleAttribute;
        this.descriptionAttribute = descriptionAttribute;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getTitleAttribute() {
        return titleAttribute;
    }

    public String getDescriptionAttribute() {
        return descriptionAttribute;
    }

    @JsonCreator
    public static LanguageCode fromCode(String code) {
        return Arrays.stream(values())
                .filter(lang -> lang.code.equalsIgnoreCase(code) || lang.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported language: " + code));
    }
}
