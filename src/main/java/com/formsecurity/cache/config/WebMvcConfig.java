package com.formsecurity.cache.config;

import com.formsecurity.cache.service.CacheOperationService;
import com.formsecurity.cache.web.RequestCacheBoundaryInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC 配置
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final CacheOperationService cacheOperationService;

    public WebMvcConfig(CacheOperationService cacheOperationService) {
        this.cacheOperationService = cacheOperationService;
    }

    /**
     * REQUEST 层以 HTTP 请求为边界
     */
    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RequestCacheBoundaryInterceptor(cacheOperationService))
            .addPathPatterns("/**")
            .excludePathPatterns("/actuator/**");
    }
}
