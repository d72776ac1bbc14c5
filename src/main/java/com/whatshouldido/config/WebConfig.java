package com.whatshouldido.config;

import com.whatshouldido.interceptor.ApiLoggingInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web 설정 - Interceptor 등록
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiLoggingInterceptor())
                .addPathPatterns("/api/**")
                .excludePathPatterns(
                    "/api/health",
                    "/h2-console/**"
                );
    }
}
