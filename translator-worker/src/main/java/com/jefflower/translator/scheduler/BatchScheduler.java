package com.jefflower.translator.scheduler;

import com.jefflower.translator.config.WorkerProperties;
import com.jefflower.translator.dto.CycleResult;
import com.jefflower.translator.enums.TriggerType;
import com.jefflower.translator.service.TranslationBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 房源翻译定时任务
 * 间隔从配置读取，默认每次批次结束后等待 300 秒
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchScheduler implements ApplicationListener<ContextClosedEvent> {

    private final TranslationBatchService translationBatchService;
    private final WorkerProperties workerProperties;

    @Scheduled(initialDelayString = "${translator.worker.initial-delay:10}",
            fixedDelayString = "${translator.worker.process-interval:300}",
            timeUnit = TimeUnit.SECONDS)
    public void scheduledCycle() {
        // 检查是否启用定时批次
        if (!workerProperties.isEnabled()) {
            log.debug("Scheduled translation is disabled");
            return;
        }

        log.info("Scheduled translation cycle triggered (batchSize={}, languages={})",
                workerProperties.getBatchSize(), workerProperties.getLanguages());
        CycleResult result = translationBatchService.runCycle(TriggerType.SCHEDULED);

        if (result.isSuccess()) {
            log.info("Scheduled cycle completed: {}", result.getMessage());
        } else {
            log.warn("Scheduled cycle skipped or failed: {}", result.getMessage());
        }
    }

    /**
     * 关闭事件先于调度器和线程池的终止等待发布
     */
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        translationBatchService.stop();
    }
}
