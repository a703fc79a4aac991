package com.formsecurity.cache.web;

import com.formsecurity.cache.service.CacheOperationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 请求边界拦截器：每个 HTTP 请求结束后清空 REQUEST 层缓存
 */
public class RequestCacheBoundaryInterceptor implements HandlerInterceptor {

    private final CacheOperationService cacheOperationService;

    public RequestCacheBoundaryInterceptor(CacheOperationService cacheOperationService) {
        this.cacheOperationService = cacheOperationService;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        cacheOperationService.endRequest();
    }
}
