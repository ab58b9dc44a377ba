package com.precojusto.cronbatch.config;

import com.precojusto.cronbatch.infrastructure.JobLease;
import com.precojusto.cronbatch.infrastructure.NoOpJobLease;
import com.precojusto.cronbatch.infrastructure.RedisJobLease;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis configuration for the per-job-type lease.
 */
@Configuration
@Slf4j
public class RedisConfig {

        @Bean
        public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory connectionFactory) {
                RedisTemplate<String, Object> template = new RedisTemplate<>();
                template.setConnectionFactory(connectionFactory);

                template.setKeySerializer(new StringRedisSerializer());
                template.setHashKeySerializer(new StringRedisSerializer());

                template.setValueSerializer(new GenericJackson2JsonRedisSerializer());
                template.setHashValueSerializer(new GenericJackson2JsonRedisSerializer());

                template.afterPropertiesSet();
                return template;
        }

        @Bean
        public JobLease jobLease(
                        ObjectProvider<RedisTemplate<String, Object>> redisTemplate,
                        @Value("${batch.lease.enabled:false}") boolean leaseEnabled,
                        @Value("${batch.host-timeout:60s}") Duration hostTimeout) {
                if (!leaseEnabled) {
                        log.info("Job lease disabled, relying on the scheduler not to overlap invocations");
                        return new NoOpJobLease();
                }
                log.info("Job lease enabled (Redis, ttl {})", hostTimeout);
                return new RedisJobLease(redisTemplate.getObject(), hostTimeout);
        }
}
