package com.precojusto.cronbatch.infrastructure;

import com.precojusto.cronbatch.domain.JobType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis-based lease: SET NX with a TTL equal to the host's hard timeout.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisJobLease implements JobLease {

    private static final String KEY_PREFIX = "cron-batch:lease:";

    // Delete only while the key still holds our token
    private static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final RedisTemplate<String, Object> redisTemplate;
    private final Duration ttl;

    @Override
    public Optional<String> tryAcquire(JobType jobType) {
        String token = UUID.randomUUID().toString();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key(jobType), token, ttl);
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Acquired lease for {} (ttl {})", jobType, ttl);
                return Optional.of(token);
            }
            log.warn("Lease for {} is held by another invocation", jobType);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.error("Redis error while acquiring lease for {}: {}", jobType, e.getMessage(), e);
            throw new IllegalStateException("Failed to acquire job lease due to Redis error", e);
        }
    }

    @Override
    public void release(JobType jobType, String token) {
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key(jobType)), token);
            if (deleted != null && deleted > 0) {
                log.debug("Released lease for {}", jobType);
            } else {
                log.warn("Lease for {} expired or was taken over before release", jobType);
            }
        } catch (DataAccessException e) {
            // the TTL frees the lease anyway
            log.error("Redis error while releasing lease for {}: {}", jobType, e.getMessage(), e);
        }
    }

    private String key(JobType jobType) {
        return KEY_PREFIX + jobType.getKey();
    }
}
