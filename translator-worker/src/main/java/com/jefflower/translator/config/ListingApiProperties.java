package com.jefflower.translator.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "translator.api")
public class ListingApiProperties {
    /** 房源详情接口，按 /{externalId} 访问 */
    @NotBlank
    private String baseUrl = "https://api-statements.tnet.ge/v1/statements";

    /** Bearer token，可为空 */
    private String token;

    /** x-website-key 请求头 */
    private String websiteKey = "myhome";

    /** 任意两次请求之间的最小间隔 */
    @NotNull
    private Duration requestDelay = Duration.ofMillis(100);

    /** 第一次重试前的等待时间，之后每次翻倍 */
    @NotNull
    private Duration backoffBase = Duration.ofSeconds(1);

    /** 重试等待时间上限 */
    @NotNull
    private Duration backoffMax = Duration.ofSeconds(30);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);
}
