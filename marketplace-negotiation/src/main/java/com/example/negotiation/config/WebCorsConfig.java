package com.example.negotiation.config;

import com.example.negotiation.service.PrincipalResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebCorsConfig implements WebMvcConfigurer {

    private final NegotiationSecurityProperties securityProperties;

    public WebCorsConfig(NegotiationSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (securityProperties.getAllowedOrigins() == null || securityProperties.getAllowedOrigins().isEmpty()) {
            return;
        }
        registry.addMapping("/api/conversations/**")
                .allowedOrigins(securityProperties.getAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                .allowedHeaders(HttpHeaders.CONTENT_TYPE, PrincipalResolver.USER_ID_HEADER,
                        PrincipalResolver.USER_VERIFIED_HEADER)
                .exposedHeaders(HttpHeaders.RETRY_AFTER)
                .maxAge(3600);
    }
}
