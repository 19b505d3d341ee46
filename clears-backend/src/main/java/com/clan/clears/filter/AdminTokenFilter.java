package com.clan.clears.filter;

import com.clan.clears.config.ClearsProperties;
import com.clan.clears.dto.CommonResponse;
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
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 保护管理员刷新接口：未携带正确 {@code X-Admin-Token} 的请求返回 401。
 * 未配置令牌时接口完全关闭。
 */
@Component
public class AdminTokenFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(AdminTokenFilter.class);

    public static final String HEADER = "X-Admin-Token";

    private final ClearsProperties properties;
    private final ObjectMapper objectMapper;

    public AdminTokenFilter(ClearsProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (HttpMethod.OPTIONS.matches(httpRequest.getMethod()) || isAuthorized(httpRequest.getHeader(HEADER))) {
            chain.doFilter(request, response);
            return;
        }

        log.warn("拒绝管理员请求: {} {}，来自 {}",
                httpRequest.getMethod(), httpRequest.getRequestURI(), httpRequest.getRemoteAddr());

        httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
        httpResponse.setCharacterEncoding(StandardCharsets.UTF_8.name());
        CommonResponse<Void> body = CommonResponse.error(HttpServletResponse.SC_UNAUTHORIZED, "Admin token required");
        httpResponse.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private boolean isAuthorized(String presented) {
        String expected = properties.getAdmin().getToken();
        if (expected == null || expected.isBlank() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }
}
