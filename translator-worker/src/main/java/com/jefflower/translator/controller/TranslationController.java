package com.jefflower.translator.controller;

import com.jefflower.translator.config.WorkerProperties;
import com.jefflower.translator.dto.ApiResponse;
import com.jefflower.translator.dto.CycleResult;
import com.jefflower.translator.dto.PropertyTranslationReport;
import com.jefflower.translator.entity.TranslationCycleLog;
import com.jefflower.translator.enums.TriggerType;
import com.jefflower.translator.service.CycleLogService;
import com.jefflower.translator.service.PropertyTranslationStore;
import com.jefflower.translator.service.TranslationBatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/translations")
@RequiredArgsConstructor
public class TranslationController {

    private final TranslationBatchService translationBatchService;
    private final PropertyTranslationStore translationStore;
    private final CycleLogService cycleLogService;
    private final WorkerProperties workerProperties;

    /**
     * 手动触发一个批次
     */
    @PostMapping("/cycles")
    public ResponseEntity<ApiResponse<Map<String, Object>>> runCycle() {
        CycleResult result = translationBatchService.runCycle(TriggerType.MANUAL);
        Map<String, Object> data = new HashMap<>();
        data.put("attempted", result.getStats().getAttempted());
        data.put("succeeded", result.getStats().getSucceeded());
        data.put("fallbackUsed", result.getStats().getFallbackUsed());
        data.put("failed", result.getStats().getFailed());
        data.put("success", result.isSuccess());
        data.put("message", result.getMessage());
        return ResponseEntity.ok(ApiResponse.ok(data));
    }

    /**
     * 诊断：同步处理单个房源
     */
    @PostMapping("/properties/{externalId}")
    public ResponseEntity<ApiResponse<PropertyTranslationReport>> translateProperty(@PathVariable String externalId) {
        PropertyTranslationReport report = translationBatchService.processSingle(externalId);
        return ResponseEntity.ok(ApiResponse.ok("房源处理完成", report));
    }

    /**
     * 获取运行状态
     */
    @GetMapping("/status")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("isRunning", translationBatchService.isRunning());
        status.put("isStopping", translationBatchService.isStopping());
        status.put("enabled", workerProperties.isEnabled());
        status.put("languages", workerProperties.getLanguages());
        status.put("batchSize", workerProperties.getBatchSize());
        status.put("pending", translationStore.countPending());
        return ResponseEntity.ok(ApiResponse.ok(status));
    }

    /**
     * 获取批次日志
     */
    @GetMapping("/logs")
    public ResponseEntity<ApiResponse<Page<TranslationCycleLog>>> getCycleLogs(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size) {
        Page<TranslationCycleLog> logs = cycleLogService.getCycleLogs(PageRequest.of(page, size));
        return ResponseEntity.ok(ApiResponse.ok(logs));
    }
}
