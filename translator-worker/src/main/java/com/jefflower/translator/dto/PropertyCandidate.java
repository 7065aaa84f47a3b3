package com.jefflower.translator.dto;

import com.jefflower.translator.entity.Property;
import lombok.Builder;
import lombok.Value;

/**
 * 一个批次内待翻译的房源快照，不跨批次缓存
 */
@Value
@Builder
public class PropertyCandidate {
    Long id;
    String externalId;
    String sourceTitle;
    String sourceDescription;

    public static PropertyCandidate from(Property property) {
        return PropertyCandidate.builder()
                .id(property.getId())
                .externalId(property.getExternalId())
                .sourceTitle(property.getTitle())
                .sourceDescription(property.getDescription())
                .build();
    }
}
