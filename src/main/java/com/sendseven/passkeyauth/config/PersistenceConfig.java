package com.sendseven.passkeyauth.config;

import com.sendseven.passkeyauth.user.InMemoryUserRepository;
import com.sendseven.passkeyauth.user.UserRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * User storage. Applications with their own user store declare a
 * {@link UserRepository} bean and this default backs off.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    @ConditionalOnMissingBean(UserRepository.class)
    public UserRepository userRepository() {
        return new InMemoryUserRepository();
    }
}
