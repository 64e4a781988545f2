package com.herzen.activity.config;

import com.herzen.activity.api.CallerIdentityInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {
    private final CallerIdentityInterceptor callerIdentityInterceptor;

    public WebConfig(CallerIdentityInterceptor callerIdentityInterceptor) {
        this.callerIdentityInterceptor = callerIdentityInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(callerIdentityInterceptor)
                .addPathPatterns("/api/activity/**");
    }
}
