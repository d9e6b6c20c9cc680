package com.sunny.trigger.dispatcher.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.trigger.core.common.Assert;
import com.sunny.trigger.core.common.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * 通过 Trigger Server 内部接口拉取调度
 * <p>
 * GET {baseUrl}/api/internal/schedules，请求头携带服务密钥，
 * 响应为 {"code":0,"data":[{id, workflowId, cronExpression, timezone}]}
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class HttpScheduleSource implements ScheduleSource {

    private static final Logger log = LoggerFactory.getLogger(HttpScheduleSource.class);

    private static final String SCHEDULES_PATH = "/api/internal/schedules";

    private final HttpClient httpClient;
    private final URI schedulesUri;
    private final String serviceKey;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public HttpScheduleSource(HttpClient httpClient, String baseUrl, String serviceKey,
                              Duration requestTimeout, ObjectMapper objectMapper) {
        this.httpClient = Assert.notNull(httpClient, "HttpClient 不能为空");
        Assert.notBlank(baseUrl, "调度来源地址不能为空");
        this.schedulesUri = URI.create(stripTrailingSlash(baseUrl) + SCHEDULES_PATH);
        this.serviceKey = Assert.notBlank(serviceKey, "服务密钥不能为空");
        this.requestTimeout = Assert.notNull(requestTimeout, "请求超时不能为空");
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ScheduleDefinition> fetchEnabled() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(schedulesUri)
                .header(Constants.SERVICE_KEY_HEADER, serviceKey)
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ScheduleSourceException("拉取调度失败: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScheduleSourceException("拉取调度被中断", e);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            log.warn("拉取调度失败: uri={}, statusCode={}, body={}", schedulesUri, statusCode, response.body());
            throw new ScheduleSourceException("拉取调度失败，HTTP 状态码: " + statusCode);
        }
        return parse(response.body());
    }

    private List<ScheduleDefinition> parse(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode data = root == null ? null : root.get("data");
            if (data == null || !data.isArray()) {
                throw new ScheduleSourceException("调度响应缺少 data 数组");
            }
            return objectMapper.convertValue(data, new TypeReference<List<ScheduleDefinition>>() {});
        } catch (IOException | IllegalArgumentException e) {
            throw new ScheduleSourceException("调度响应无法解析: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
