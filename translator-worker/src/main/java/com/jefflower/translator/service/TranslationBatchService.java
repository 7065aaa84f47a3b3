package com.jefflower.translator.service;

import com.jefflower.translator.config.WorkerProperties;
import com.jefflower.translator.dto.CycleResult;
import com.jefflower.translator.dto.CycleStats;
import com.jefflower.translator.dto.PropertyCandidate;
import com.jefflower.translator.dto.PropertyTranslationReport;
import com.jefflower.translator.dto.PropertyUpdate;
import com.jefflower.translator.entity.TranslationCycleLog;
import com.jefflower.translator.enums.PropertyOutcome;
import com.jefflower.translator.enums.TriggerType;
import com.jefflower.translator.exception.PersistenceFailureException;
import com.jefflower.translator.exception.PropertyNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Service
public class TranslationBatchService {

    private final PropertyTranslationStore translationStore;
    private final MultilingualProcessor multilingualProcessor;
    private final CycleLogService cycleLogService;
    private final WorkerProperties workerProperties;
    private final ShutdownSignal shutdownSignal;
    private final Executor propertyTaskExecutor;

    // 批次互斥锁，防止手动触发和定时任务重叠
    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public TranslationBatchService(PropertyTranslationStore translationStore,
                                   MultilingualProcessor multilingualProcessor,
                                   CycleLogService cycleLogService,
                                   WorkerProperties workerProperties,
                                   ShutdownSignal shutdownSignal,
                                   @Qualifier("propertyTaskExecutor") Executor propertyTaskExecutor) {
        this.translationStore = translationStore;
        this.multilingualProcessor = multilingualProcessor;
        this.cycleLogService = cycleLogService;
        this.workerProperties = workerProperties;
        this.shutdownSignal = shutdownSignal;
        this.propertyTaskExecutor = propertyTaskExecutor;
    }

    /**
     * 带锁的批次执行（供定时任务和手动触发调用）
     */
    public CycleResult runCycle(TriggerType triggerType) {
        if (stopping.get()) {
            return new CycleResult(CycleStats.empty(), false, "服务正在关闭");
        }
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Translation cycle already in progress, skipping {} cycle", triggerType);
            return new CycleResult(CycleStats.empty(), false, "批次正在执行中，请稍后重试");
        }

        TranslationCycleLog cycleLog = null;
        try {
            cycleLog = cycleLogService.createCycleLog(triggerType);
            CycleStats stats = doRunCycle();
            cycleLogService.completeCycleLog(cycleLog, stats);
            return new CycleResult(stats, true, String.format("批次完成：处理 %d，成功 %d，兜底 %d，失败 %d",
                    stats.getAttempted(), stats.getSucceeded(), stats.getFallbackUsed(), stats.getFailed()));
        } catch (Exception e) {
            // 连不上数据库等批次级错误：记录后等待下一个批次
            log.error("Translation cycle failed", e);
            if (cycleLog != null) {
                try {
                    cycleLogService.failCycleLog(cycleLog, e.getMessage());
                } catch (Exception logError) {
                    log.error("Failed to record cycle failure: {}", logError.getMessage());
                }
            }
            return new CycleResult(CycleStats.empty(), false, "批次失败: " + e.getMessage());
        } finally {
            isRunning.set(false);
        }
    }

    private CycleStats doRunCycle() {
        long start = System.currentTimeMillis();
        List<PropertyCandidate> candidates = translationStore.findCandidates(workerProperties.getBatchSize());
        if (candidates.isEmpty()) {
            log.info("No properties need translation");
            return CycleStats.empty();
        }

        log.info("Found {} properties to translate (concurrent={})", candidates.size(), workerProperties.isConcurrent());
        List<PropertyOutcome> outcomes = workerProperties.isConcurrent()
                ? processConcurrently(candidates)
                : processSequentially(candidates);

        CycleStats stats = CycleStats.of(outcomes, System.currentTimeMillis() - start);
        log.info("Cycle finished: attempted={}, succeeded={}, fallback={}, failed={}, skipped={}, rate={}/s",
                stats.getAttempted(), stats.getSucceeded(), stats.getFallbackUsed(), stats.getFailed(),
                stats.getSkipped(), String.format("%.2f", stats.getProcessingRate()));
        return stats;
    }

    private List<PropertyOutcome> processSequentially(List<PropertyCandidate> candidates) {
        List<PropertyOutcome> outcomes = new ArrayList<>(candidates.size());
        for (PropertyCandidate candidate : candidates) {
            outcomes.add(processCandidate(candidate));
        }
        return outcomes;
    }

    private List<PropertyOutcome> processConcurrently(List<PropertyCandidate> candidates) {
        List<CompletableFuture<PropertyOutcome>> futures = candidates.stream()
                .map(candidate -> CompletableFuture.supplyAsync(() -> processCandidate(candidate), propertyTaskExecutor))
                .toList();
        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    /**
     * 处理并写入单个房源，任何错误都只计入该房源，不影响批次
     */
    PropertyOutcome processCandidate(PropertyCandidate candidate) {
        if (stopping.get()) {
            return PropertyOutcome.SKIPPED;
        }
        long start = System.currentTimeMillis();
        try {
            PropertyUpdate update = multilingualProcessor.process(candidate);
            PropertyOutcome outcome = persist(candidate, update);
            log.info("Property {} ({}) -> {} in {}ms", candidate.getId(), candidate.getExternalId(), outcome,
                    System.currentTimeMillis() - start);
            return outcome;
        } catch (PersistenceFailureException e) {
            log.warn("Property {} ({}) not saved: {}", candidate.getId(), candidate.getExternalId(), e.getMessage());
            return PropertyOutcome.FAILED;
        } catch (Exception e) {
            log.error("Error processing property {} ({})", candidate.getId(), candidate.getExternalId(), e);
            return PropertyOutcome.FAILED;
        }
    }

    private PropertyOutcome persist(PropertyCandidate candidate, PropertyUpdate update) {
        if (update.isEmpty()) {
            translationStore.recordAttempt(candidate.getId());
            return PropertyOutcome.FAILED;
        }
        translationStore.applyUpdate(candidate.getId(), update);
        return update.usedFallback() ? PropertyOutcome.SUCCEEDED_WITH_FALLBACK : PropertyOutcome.SUCCEEDED;
    }

    /**
     * 诊断模式：跳过候选查询，按外部 id 同步处理单个房源。
     * 与批次共用同一把锁，批次执行中时拒绝
     */
    public PropertyTranslationReport processSingle(String externalId) {
        if (stopping.get()) {
            throw new IllegalStateException("服务正在关闭");
        }
        if (!isRunning.compareAndSet(false, true)) {
            throw new IllegalStateException("批次正在执行中，请稍后重试");
        }
        try {
            PropertyCandidate candidate = translationStore.findByExternalId(externalId)
                    .orElseThrow(() -> new PropertyNotFoundException(externalId));

            log.info("Diagnostic translation for property {} ({})", candidate.getId(), externalId);
            PropertyUpdate update = multilingualProcessor.process(candidate);
            PropertyOutcome outcome = persist(candidate, update);
            return PropertyTranslationReport.builder()
                    .propertyId(candidate.getId())
                    .externalId(externalId)
                    .outcome(outcome)
                    .results(new ArrayList<>(update.getResults().values()))
                    .build();
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * 停止派发新的房源，并打断限流和退避等待；进行中的房源继续完成写库
     */
    public void stop() {
        if (stopping.compareAndSet(false, true)) {
            log.info("Stopping translation worker, in-flight properties will finish");
            shutdownSignal.signal();
        }
    }

    public boolean isRunning() {
        return isRunning.get();
    }

    public boolean isStopping() {
        return stopping.get();
    }
}
