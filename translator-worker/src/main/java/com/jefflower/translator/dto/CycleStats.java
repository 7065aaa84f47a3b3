package com.jefflower.translator.dto;

import com.jefflower.translator.enums.PropertyOutcome;
import lombok.Builder;
import lombok.Getter;

import java.util.Collection;

/**
 * 批次统计，fallbackUsed 是 succeeded 的子集
 */
@Getter
@Builder
public class CycleStats {
    private final int attempted;
    private final int succeeded;
    private final int fallbackUsed;
    private final int failed;
    private final int skipped;
    private final long durationMs;

    public static CycleStats empty() {
        return CycleStats.builder().build();
    }

    public static CycleStats of(Collection<PropertyOutcome> outcomes, long durationMs) {
        int succeeded = 0;
        int fallback = 0;
        int failed = 0;
        int skipped = 0;
        for (PropertyOutcome outcome : outcomes) {
            switch (outcome) {
                case SUCCEEDED -> succeeded++;
                case SUCCEEDED_WITH_FALLBACK -> {
                    succeeded++;
                    fallback++;
                }
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        return CycleStats.builder()
                .attempted(succeeded + failed)
                .succeeded(succeeded)
                .fallbackUsed(fallback)
                .failed(failed)
                .skipped(skipped)
                .durationMs(durationMs)
                .build();
    }

    /**
     * 每秒处理的房源数
     */
    public double getProcessingRate() {
        if (durationMs <= 0) {
            return 0.0;
        }
        return attempted * 1000.0 / durationMs;
    }
}
