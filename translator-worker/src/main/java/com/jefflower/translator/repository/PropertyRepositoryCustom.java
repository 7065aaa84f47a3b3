package com.jefflower.translator.repository;

import com.jefflower.translator.entity.Property;
import com.jefflower.translator.enums.LanguageCode;

import java.util.Collection;
import java.util.List;

public interface PropertyRepositoryCustom {

    /**
     * 查询至少一种目标语言缺少标题或描述的房源。
     * 从未尝试过的排在最前，其余按上次尝试时间、id 升序，最多返回 limit 条。
     */
    List<Property> findCandidates(int limit, Collection<LanguageCode> languages);

    long countCandidates(Collection<LanguageCode> languages);
}
