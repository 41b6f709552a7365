package org.example.keygen.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.example.keygen.config.KeygenProperties;
import org.example.keygen.model.ResultRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Optional;

/**
 * {@link ResultStore} on Redis, shared by every instance of the service.
 *
 * <p>Each record is one string key holding its JSON form. Creation is {@code SET NX PX}
 * with the time left until {@code expiresAt}, so Redis evicts the record on its own.
 * Compare-and-set runs as a Lua script that swaps the value only while it is still the
 * expected one, keeping the key's remaining time to live.
 */
@Component
public class RedisResultStore implements ResultStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisResultStore.class);

    private static final RedisScript<Long> COMPARE_AND_SET = RedisScript.of(
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    redis.call('set', KEYS[1], ARGV[2], 'KEEPTTL') " +
            "    return 1 " +
            "else " +
            "    return 0 " +
            "end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;

    public RedisResultStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock,
                            KeygenProperties properties) {
        this.redisTemplate = redisTemplate;
        // ISO instants, so a record always serializes to the same string
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
        this.keyPrefix = properties.getStore().getKeyPrefix();
    }

    @Override
    public Optional<ResultRecord> find(String requestId) {
        if (requestId == null) {
            return Optional.empty();
        }
        String value;
        try {
            value = redisTemplate.opsForValue().get(key(requestId));
        } catch (DataAccessException e) {
            throw new ResultStoreException("Failed to read result record " + requestId, e);
        }
        if (value == null) {
            return Optional.empty();
        }
        ResultRecord record = read(requestId, value);
        // Redis expires on its own clock; don't serve a record past its expiry in ours
        if (record.isExpired(clock.instant())) {
            logger.debug("Record {} is past its expiry, treating as absent", requestId);
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public boolean createIfAbsent(ResultRecord record) {
        Duration timeToLive = Duration.between(clock.instant(), record.expiresAt());
        if (timeToLive.toMillis() <= 0) {
            throw new IllegalArgumentException("Record " + record.requestId() + " is already expired");
        }
        try {
            Boolean created = redisTemplate.opsForValue()
                    .setIfAbsent(key(record.requestId()), write(record), timeToLive);
            return Boolean.TRUE.equals(created);
        } catch (DataAccessException e) {
            throw new ResultStoreException("Failed to create result record " + record.requestId(), e);
        }
    }

    @Override
    public boolean compareAndSet(ResultRecord expected, ResultRecord updated) {
        ResultStore.checkUpdate(expected, updated);
        if (expected.isExpired(clock.instant())) {
            return false;
        }
        try {
            Long swapped = redisTemplate.execute(COMPARE_AND_SET,
                    Collections.singletonList(key(expected.requestId())),
                    write(expected), write(updated));
            return swapped != null && swapped == 1L;
        } catch (DataAccessException e) {
            throw new ResultStoreException("Failed to update result record " + expected.requestId(), e);
        }
    }

    String key(String requestId) {
        return keyPrefix + requestId;
    }

    private String write(ResultRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result record " + record.requestId(), e);
        }
    }

    private ResultRecord read(String requestId, String value) {
        try {
            return objectMapper.readValue(value, ResultRecord.class);
        } catch (JsonProcessingException e) {
            throw new ResultStoreException("Unreadable result record " + requestId, e);
        }
    }
}
