package com.jefflower.translator.enums;

/**
 * 翻译内容来源
 */
public enum TranslationOrigin {
    API, // 房源接口返回的对应语言内容
    FALLBACK, // 本地词典替换
    NONE // 无可用内容，不写入
}
