package com.community.moderation.filter;

import com.community.moderation.dto.CommonResponse;
import com.community.moderation.model.RequestPrincipal;
import com.community.moderation.model.UserRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 认证过滤器：从网关注入的请求头读取调用方身份。
 * 缺少或无法识别身份时直接返回 401 信封，不进入控制器。
 */
@Component
public class PrincipalFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(PrincipalFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";
    public static final String PRINCIPAL_ATTRIBUTE = PrincipalFilter.class.getName() + ".principal";

    private static final int MAX_USER_ID_LENGTH = 64;

    private final ObjectMapper objectMapper;

    public PrincipalFilter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        // CORS 预检请求不带身份
        if (HttpMethod.OPTIONS.matches(httpRequest.getMethod())) {
            chain.doFilter(request, response);
            return;
        }

        String userId = httpRequest.getHeader(USER_ID_HEADER);
        if (userId == null || userId.isBlank() || userId.trim().length() > MAX_USER_ID_LENGTH) {
            reject(httpRequest, httpResponse, "Authentication required");
            return;
        }

        String roleHeader = httpRequest.getHeader(ROLE_HEADER);
        UserRole role = roleHeader == null || roleHeader.isBlank() ? UserRole.USER : UserRole.fromCode(roleHeader);
        if (role == null) {
            reject(httpRequest, httpResponse, "Unknown role: " + roleHeader);
            return;
        }

        httpRequest.setAttribute(PRINCIPAL_ATTRIBUTE, new RequestPrincipal(userId.trim(), role));
        chain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String message) throws IOException {
        log.warn("拦截未认证请求: {} {} ({})", request.getMethod(), request.getRequestURI(), message);

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(CommonResponse.error("AUTH_ERROR", message)));
    }
}
