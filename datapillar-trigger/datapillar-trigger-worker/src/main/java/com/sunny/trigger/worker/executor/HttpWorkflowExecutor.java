package com.sunny.trigger.worker.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sunny.trigger.core.common.Assert;
import com.sunny.trigger.core.common.Constants;
import com.sunny.trigger.core.util.ThrowableUtil;
import com.sunny.trigger.worker.runtime.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 通过 HTTP 调用工作流执行服务
 * <p>
 * POST {baseUrl}/api/workflow/{workflowId}/execute
 * <pre>
 * 请求: {"executionId": "...", "input": {...}}
 * 响应: {"success": true|false, "error": "...", "output": {...}}
 * </pre>
 * 请求异步发出，取消令牌触发时立即放弃等待。
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public class HttpWorkflowExecutor implements WorkflowExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkflowExecutor.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String serviceKey;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public HttpWorkflowExecutor(HttpClient httpClient, String baseUrl, String serviceKey,
                                Duration requestTimeout, ObjectMapper objectMapper) {
        this.httpClient = Assert.notNull(httpClient, "HttpClient 不能为空");
        String url = Assert.notBlank(baseUrl, "工作流服务地址不能为空").trim();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.serviceKey = Assert.notBlank(serviceKey, "服务密钥不能为空");
        this.requestTimeout = Assert.notNull(requestTimeout, "请求超时不能为空");
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkflowExecutionResult execute(WorkflowExecutionRequest request, CancellationToken token) {
        if (token.isCancelled()) {
            throw new WorkflowCancelledException("调用前已收到终止信号");
        }
        URI uri = URI.create(baseUrl + "/api/workflow/" + request.workflowId() + "/execute");
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", "application/json; charset=utf-8")
                .header(Constants.SERVICE_KEY_HEADER, serviceKey)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(buildBody(request), StandardCharsets.UTF_8))
                .build();

        log.info("调用工作流服务: uri={}, executionId={}", uri, request.executionId());
        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        Runnable unregister = token.onCancel(() -> future.cancel(true));

        HttpResponse<String> response;
        try {
            response = future.get();
        } catch (CancellationException e) {
            throw new WorkflowCancelledException("工作流调用已取消", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new WorkflowCancelledException("工作流调用被中断", e);
        } catch (ExecutionException e) {
            if (token.isCancelled()) {
                throw new WorkflowCancelledException("工作流调用已取消", e.getCause());
            }
            throw new WorkflowExecutorException("调用工作流服务失败: " + ThrowableUtil.rootMessage(e), e.getCause());
        } finally {
            unregister.run();
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            log.warn("工作流服务返回异常状态: uri={}, statusCode={}, body={}", uri, statusCode, response.body());
            throw new WorkflowExecutorException("工作流服务返回 HTTP 状态码: " + statusCode);
        }
        return parseResult(response.body());
    }

    private String buildBody(WorkflowExecutionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("executionId", request.executionId());
        if (request.input() != null) {
            body.set("input", request.input());
        } else {
            body.set("input", objectMapper.createObjectNode());
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new WorkflowExecutorException("请求体序列化失败", e);
        }
    }

    private WorkflowExecutionResult parseResult(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new WorkflowExecutorException("工作流服务响应不是合法 JSON", e);
        }
        if (root == null || !root.isObject() || !root.path("success").isBoolean()) {
            throw new WorkflowExecutorException("工作流服务响应缺少 success 字段");
        }
        JsonNode output = root.get("output");
        if (output != null && output.isNull()) {
            output = null;
        }
        if (root.get("success").asBoolean()) {
            return WorkflowExecutionResult.ok(output);
        }
        JsonNode error = root.get("error");
        String message = error == null || error.isNull() ? "工作流执行失败" : error.asText();
        return new WorkflowExecutionResult(false, ThrowableUtil.truncate(message), output);
    }
}
