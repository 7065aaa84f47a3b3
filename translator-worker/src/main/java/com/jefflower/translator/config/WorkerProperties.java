package com.jefflower.translator.config;

import com.jefflower.translator.enums.LanguageCode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "translator.worker")
public class WorkerProperties {
    /** 是否启用定时批次 */
    private boolean enabled = true;

    /** 每个批次最多处理的房源数 */
    @Positive
    private int batchSize = 50;

    /** 启动后第一个批次前的等待（秒） */
    @Min(0)
    private long initialDelay = 10;

    /** 两个批次之间的间隔（秒） */
    @Positive
    private long processInterval = 300;

    /** 临时错误和限流的最大重试次数 */
    @Min(0)
    private int maxRetries = 3;

    /** 输出原始报文和每次调用耗时 */
    private boolean debugMode = false;

    /** 批次内是否并发处理房源 */
    private boolean concurrent = false;

    /** 并发处理的线程数 */
    @Positive
    private int concurrency = 4;

    /** 需要补全的目标语言 */
    @NotEmpty
    private List<LanguageCode> languages = new ArrayList<>(List.of(LanguageCode.EN, LanguageCode.RU));

    /** 关闭时等待进行中房源完成的时间（秒） */
    @Min(0)
    private int shutdownGracePeriod = 30;
}
