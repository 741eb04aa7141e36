package com.keg.roster.config;

import com.keg.roster.api.UserController;
import com.keg.roster.infrastructure.web.AuthenticationInterceptor;
import com.keg.roster.infrastructure.web.CorrelationIdFilter;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for the member portal and bearer-token authentication on the API.
 * <p>
 * The token headers must be exposed, otherwise a browser client cannot read them from the
 * login response. Login and renewal read their own credentials, so an expired access token
 * sent along with them is ignored.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AuthenticationInterceptor authenticationInterceptor;

    public WebConfig(AuthenticationInterceptor authenticationInterceptor) {
        this.authenticationInterceptor = authenticationInterceptor;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(HttpHeaders.AUTHORIZATION, UserController.RENEWAL_HEADER,
                        CorrelationIdFilter.CORRELATION_ID_HEADER)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authenticationInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns("/api/v1/user/login", "/api/v1/user/renew");
    }
}
