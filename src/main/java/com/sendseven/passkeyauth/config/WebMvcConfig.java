package com.sendseven.passkeyauth.config;

import com.sendseven.passkeyauth.session.AuthSessionArgumentResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Lets controllers declare an {@link com.sendseven.passkeyauth.session.AuthSession} parameter.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new AuthSessionArgumentResolver());
    }
}
