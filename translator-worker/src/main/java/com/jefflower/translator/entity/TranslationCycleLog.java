package com.jefflower.translator.entity;

import com.jefflower.translator.enums.CycleStatus;
import com.jefflower.translator.enums.TriggerType;
import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

/**
 * 翻译批次日志表
 * 记录每个批次的统计信息
 */
@Data
@Entity
@Table(name = "translation_cycle_log")
public class TranslationCycleLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "attempted")
    private Integer attempted = 0;

    @Column(name = "succeeded")
    private Integer succeeded = 0;

    @Column(name = "fallback_used")
    private Integer fallbackUsed = 0;

    @Column(name = "failed")
    private Integer failed = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16)
    private CycleStatus status = CycleStatus.RUNNING;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", length = 16)
    private TriggerType triggerType;

    @Column(name = "error_message", length = 1024)
    private String errorMessage;
}
