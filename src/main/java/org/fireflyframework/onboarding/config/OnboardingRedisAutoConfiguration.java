/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.onboarding.config;

import org.fireflyframework.onboarding.persistence.OrchestrationStore;
import org.fireflyframework.onboarding.persistence.impl.RedisOrchestrationStore;
import org.fireflyframework.onboarding.persistence.serialization.JsonOrchestrationSerializer;
import org.fireflyframework.onboarding.persistence.serialization.OrchestrationSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Clock;

/**
 * Auto-configuration for Redis-backed orchestration storage.
 * <p>
 * Only loaded when Spring Data Redis is on the classpath and
 * {@code firefly.onboarding.persistence.enabled=true}. Runs after Spring Boot's Redis auto-configuration:
 * a connection factory configured through {@code spring.data.redis.*} is reused and the
 * {@code firefly.onboarding.persistence.redis} connection settings are then ignored.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration")
@EnableConfigurationProperties(OnboardingOrchestratorProperties.class)
@ConditionalOnClass({ReactiveRedisConnectionFactory.class, ReactiveRedisTemplate.class})
@ConditionalOnProperty(
    name = "firefly.onboarding.persistence.enabled",
    havingValue = "true",
    matchIfMissing = false
)
public class OnboardingRedisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OnboardingRedisAutoConfiguration.class);

    /**
     * Connection factory, unless the application already provides one.
     */
    @Bean
    @ConditionalOnMissingBean(ReactiveRedisConnectionFactory.class)
    public LettuceConnectionFactory onboardingRedisConnectionFactory(OnboardingOrchestratorProperties properties) {
        OnboardingOrchestratorProperties.RedisProperties redis = properties.getPersistence().getRedis();

        log.info("Configuring Redis connection factory for onboarding orchestration: {}:{}",
                redis.getHost(), redis.getPort());

        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(redis.getHost(), redis.getPort());
        configuration.setDatabase(redis.getDatabase());
        if (redis.getPassword() != null) {
            configuration.setPassword(redis.getPassword());
        }
        LettuceConnectionFactory factory = new LettuceConnectionFactory(configuration);
        factory.setValidateConnection(true);
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean(name = "onboardingRedisTemplate")
    public ReactiveStringRedisTemplate onboardingRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        return new ReactiveStringRedisTemplate(connectionFactory);
    }

    @Bean
    @Primary
    public OrchestrationStore redisOrchestrationStore(ReactiveStringRedisTemplate onboardingRedisTemplate,
                                                      ObjectProvider<OrchestrationSerializer> serializer,
                                                      ObjectProvider<Clock> clock,
                                                      OnboardingOrchestratorProperties properties) {
        String keyPrefix = properties.getPersistence().getRedis().getKeyPrefix();
        log.info("Configuring Redis orchestration store with key prefix: {}", keyPrefix);
        return new RedisOrchestrationStore(onboardingRedisTemplate,
                serializer.getIfAvailable(JsonOrchestrationSerializer::new),
                keyPrefix,
                clock.getIfAvailable(Clock::systemUTC));
    }
}
