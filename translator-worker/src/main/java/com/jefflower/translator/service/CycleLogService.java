package com.jefflower.translator.service;

import com.jefflower.translator.dto.CycleStats;
import com.jefflower.translator.entity.TranslationCycleLog;
import com.jefflower.translator.enums.CycleStatus;
import com.jefflower.translator.enums.TriggerType;
import com.jefflower.translator.repository.TranslationCycleLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 批次日志管理
 */
@Service
@RequiredArgsConstructor
public class CycleLogService {

    private final TranslationCycleLogRepository logRepository;

    public Page<TranslationCycleLog> getCycleLogs(Pageable pageable) {
        return logRepository.findAllByOrderByStartTimeDesc(pageable);
    }

    @Transactional
    public TranslationCycleLog createCycleLog(TriggerType triggerType) {
        TranslationCycleLog cycleLog = new TranslationCycleLog();
        cycleLog.setStartTime(LocalDateTime.now());
        cycleLog.setTriggerType(triggerType);
        cycleLog.setStatus(CycleStatus.RUNNING);
        return logRepository.save(cycleLog);
    }

    @Transactional
    public void completeCycleLog(TranslationCycleLog cycleLog, CycleStats stats) {
        cycleLog.setEndTime(LocalDateTime.now());
        cycleLog.setAttempted(stats.getAttempted());
        cycleLog.setSucceeded(stats.getSucceeded());
        cycleLog.setFallbackUsed(stats.getFallbackUsed());
        cycleLog.setFailed(stats.getFailed());
        cycleLog.setStatus(CycleStatus.SUCCESS);
        logRepository.save(cycleLog);
    }

    @Transactional
    public void failCycleLog(TranslationCycleLog cycleLog, String errorMessage) {
        cycleLog.setEndTime(LocalDateTime.now());
        cycleLog.setStatus(CycleStatus.FAILED);
        cycleLog.setErrorMessage(errorMessage != null && errorMessage.length() > 1024
                ? errorMessage.substring(0, 1024) : errorMessage);
        logRepository.save(cycleLog);
    }
}
