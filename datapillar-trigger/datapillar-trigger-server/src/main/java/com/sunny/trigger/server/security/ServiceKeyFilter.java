package com.sunny.trigger.server.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.trigger.core.common.Constants;
import com.sunny.trigger.server.common.ApiResponse;
import com.sunny.trigger.server.config.ServiceKeyProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 内部接口服务密钥过滤器
 * <p>
 * 只拦截 /api/internal/**，密钥按常量时间比较。服务端未配置密钥时一律拒绝。
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Component
public class ServiceKeyFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ServiceKeyFilter.class);

    private final ServiceKeyProperties properties;
    private final ObjectMapper objectMapper;

    public ServiceKeyFilter(ServiceKeyProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith(properties.getInternalPathPrefix());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String expected = properties.getServiceKey();
        if (expected == null || expected.isBlank()) {
            log.error("未配置服务密钥，拒绝内部请求: {}", request.getRequestURI());
            reject(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "服务密钥未配置");
            return;
        }

        String provided = request.getHeader(Constants.SERVICE_KEY_HEADER);
        if (provided == null || !matches(expected, provided)) {
            log.warn("服务密钥缺失或无效: uri={}, remote={}", request.getRequestURI(), request.getRemoteAddr());
            reject(response, HttpServletResponse.SC_UNAUTHORIZED, "未授权");
            return;
        }

        chain.doFilter(request, response);
    }

    static boolean matches(String expected, String provided) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    private void reject(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), ApiResponse.error(status, message));
    }
}
