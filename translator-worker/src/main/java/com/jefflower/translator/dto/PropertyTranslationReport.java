package com.jefflower.translator.dto;

import com.jefflower.translator.enums.PropertyOutcome;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 单个房源诊断模式的返回内容
 */
@Data
@Builder
public class PropertyTranslationReport {
    private Long propertyId;
    private String externalId;
    private PropertyOutcome outcome;
    private List<TranslationResult> results;
}
