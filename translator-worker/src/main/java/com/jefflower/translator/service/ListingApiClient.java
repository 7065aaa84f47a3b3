package com.jefflower.translator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jefflower.translator.config.ListingApiProperties;
import com.jefflower.translator.config.WorkerProperties;
import com.jefflower.translator.dto.LocalizedContent;
import com.jefflower.translator.enums.LanguageCode;
import com.jefflower.translator.exception.TranslationFetchException;
import com.jefflower.translator.exception.TranslationFetchException.FailureType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * 房源接口客户端：按语言获取单个房源的标题和描述。
 * 临时错误和限流按指数退避重试，其余错误直接抛出。
 */
@Slf4j
@Service
public class ListingApiClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ListingApiProperties apiProperties;
    private final WorkerProperties workerProperties;
    private final ShutdownSignal shutdownSignal;

    // 所有线程共享的上次请求时间，保证请求间隔
    private final Object throttleLock = new Object();
    private long lastCallNanos = -1;

    public ListingApiClient(RestTemplate listingApiRestTemplate, ObjectMapper objectMapper,
                            ListingApiProperties apiProperties, WorkerProperties workerProperties,
                            ShutdownSignal shutdownSignal) {
        this.restTemplate = listingApiRestTemplate;
        this.objectMapper = objectMapper;
        this.apiProperties = apiProperties;
        this.workerProperties = workerProperties;
        this.shutdownSignal = shutdownSignal;
    }

    public LocalizedContent fetch(String externalId, LanguageCode language) {
        int maxRetries = workerProperties.getMaxRetries();
        int retries = 0;
        while (true) {
            try {
                return fetchOnce(externalId, language);
            } catch (TranslationFetchException e) {
                if (!e.isRetryable() || retries >= maxRetries) {
                    throw e;
                }
                retries++;
                Duration delay = backoffDelay(retries);
                log.warn("Listing API call for {} [{}] failed with {}, retry {}/{} in {}ms",
                        externalId, language.getCode(), e.getType(), retries, maxRetries, delay.toMillis());
                if (shutdownSignal.await(delay)) {
                    throw new TranslationFetchException(FailureType.TRANSIENT, externalId, language,
                            "shutdown requested during backoff", e);
                }
            }
        }
    }

    /**
     * 第 retry 次重试前的等待时间：base * 2^(retry-1)，不超过上限
     */
    Duration backoffDelay(int retry) {
        Duration base = apiProperties.getBackoffBase();
        Duration max = apiProperties.getBackoffMax();
        long factor = 1L << Math.min(Math.max(retry - 1, 0), 30);
        Duration delay = base.multipliedBy(factor);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private LocalizedContent fetchOnce(String externalId, LanguageCode language) {
        if (!throttle()) {
            throw new TranslationFetchException(FailureType.TRANSIENT, externalId, language, "shutdown requested");
        }

        long start = System.currentTimeMillis();
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    apiProperties.getBaseUrl() + "/{externalId}", HttpMethod.GET,
                    new HttpEntity<>(createHeaders(language)), String.class, externalId);

            if (workerProperties.isDebugMode()) {
                log.info("Listing API {} [{}] -> {} in {}ms, payload={}", externalId, language.getCode(),
                        response.getStatusCode().value(), System.currentTimeMillis() - start, response.getBody());
            }
            return parse(externalId, language, response.getBody());
        } catch (RestClientResponseException e) {
            if (workerProperties.isDebugMode()) {
                log.info("Listing API {} [{}] -> {} in {}ms, body={}", externalId, language.getCode(),
                        e.getStatusCode().value(), System.currentTimeMillis() - start, e.getResponseBodyAsString());
            }
            throw new TranslationFetchException(classify(e.getStatusCode().value()), externalId, language,
                    "HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new TranslationFetchException(FailureType.TRANSIENT, externalId, language,
                    "I/O error: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TranslationFetchException(FailureType.TRANSIENT, externalId, language, e.getMessage(), e);
        }
    }

    private FailureType classify(int status) {
        if (status == 404 || status == 410) {
            return FailureType.NOT_FOUND;
        }
        if (status == 401 || status == 403) {
            return FailureType.AUTH_ERROR;
        }
        if (status == 429) {
            return FailureType.RATE_LIMITED;
        }
        if (status >= 500) {
            return FailureType.TRANSIENT;
        }
        return FailureType.MALFORMED;
    }

    /**
     * 解析房源报文：优先 data.statement，其次 data，最后根对象。
     * 标题取 dynamic_title / title，描述取 comment / description，两者都没有视为报文异常。
     */
    LocalizedContent parse(String externalId, LanguageCode language, String body) {
        if (body == null || body.isBlank()) {
            throw new TranslationFetchException(FailureType.MALFORMED, externalId, language, "empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TranslationFetchException(FailureType.MALFORMED, externalId, language,
                    "response is not JSON", e);
        }

        JsonNode statement = root.path("data");
        if (statement.has("statement")) {
            statement = statement.get("statement");
        }
        if (!statement.isObject()) {
            statement = root;
        }

        String title = firstText(statement, List.of("dynamic_title", "title"));
        String description = firstText(statement, List.of("comment", "description"));
        if (title == null && description == null) {
            throw new TranslationFetchException(FailureType.MALFORMED, externalId, language,
                    "payload has neither title nor description");
        }
        return LocalizedContent.of(title, description);
    }

    private String firstText(JsonNode node, List<String> fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private HttpHeaders createHeaders(LanguageCode language) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("locale", language.getCode());
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, language.getCode());
        if (apiProperties.getWebsiteKey() != null && !apiProperties.getWebsiteKey().isBlank()) {
            headers.set("x-website-key", apiProperties.getWebsiteKey());
        }
        if (apiProperties.getToken() != null && !apiProperties.getToken().isBlank()) {
            headers.setBearerAuth(apiProperties.getToken());
        }
        return headers;
    }

    /**
     * 与上次请求保持最小间隔
     *
     * @return 收到关闭信号时返回 false，不再发请求
     */
    private boolean throttle() {
        synchronized (throttleLock) {
            if (shutdownSignal.isSignalled()) {
                return false;
            }
            if (lastCallNanos >= 0) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - lastCallNanos);
                Duration remaining = apiProperties.getRequestDelay().minus(elapsed);
                if (shutdownSignal.await(remaining)) {
                    return false;
                }
            }
            lastCallNanos = System.nanoTime();
            return true;
        }
    }
}
