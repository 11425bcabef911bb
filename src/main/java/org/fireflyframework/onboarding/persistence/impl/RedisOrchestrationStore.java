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

package org.fireflyframework.onboarding.persistence.impl;

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.core.StepRecord;
import org.fireflyframework.onboarding.persistence.ClaimResult;
import org.fireflyframework.onboarding.persistence.CreateResult;
import org.fireflyframework.onboarding.persistence.LeaseLostException;
import org.fireflyframework.onboarding.persistence.OrchestrationStore;
import org.fireflyframework.onboarding.persistence.OrchestrationStoreException;
import org.fireflyframework.onboarding.persistence.StaleTransitionException;
import org.fireflyframework.onboarding.persistence.Transition;
import org.fireflyframework.onboarding.persistence.serialization.OrchestrationSerializer;
import org.fireflyframework.onboarding.persistence.serialization.OrchestrationSerializer.SerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Redis-based implementation of {@link OrchestrationStore}.
 * <p>
 * Every mutation is one Lua script, so the record, its metadata hash, the step list and the indexes
 * change together or not at all. Lease expiry is computed from the caller's clock; workers sharing a
 * Redis instance are expected to have synchronized clocks.
 * <p>
 * Redis key structure:
 * <ul>
 *   <li>{prefix}record:{id} - record JSON</li>
 *   <li>{prefix}meta:{id} - hash: version, state, terminal, owner, leaseUntil (epoch millis)</li>
 *   <li>{prefix}steps:{id} - list of step row JSON, in commit order</li>
 *   <li>{prefix}idem:{key} - orchestration id for an idempotency key</li>
 *   <li>{prefix}state:{STATE} - set of orchestration ids currently in that state</li>
 *   <li>{prefix}active - sorted set of non-terminal ids scored by last update (epoch millis)</li>
 * </ul>
 * The scripts derive the previous state's set key from the prefix, so all keys must live on one node.
 */
public class RedisOrchestrationStore implements OrchestrationStore {

    private static final Logger log = LoggerFactory.getLogger(RedisOrchestrationStore.class);

    private static final RedisScript<String> CREATE = RedisScript.of(String.join("\n",
            "local existing = redis.call('GET', KEYS[1])",
            "if existing then",
            "  return existing",
            "end",
            "redis.call('SET', KEYS[1], ARGV[1])",
            "redis.call('SET', KEYS[2], ARGV[2])",
            "redis.call('HSET', KEYS[3], 'version', '0', 'state', ARGV[3], 'terminal', '0')",
            "redis.call('SADD', KEYS[4], ARGV[1])",
            "redis.call('ZADD', KEYS[5], ARGV[4], ARGV[1])",
            "return ARGV[1]"), String.class);

    private static final RedisScript<String> CLAIM = RedisScript.of(String.join("\n",
            "if redis.call('EXISTS', KEYS[1]) == 0 then",
            "  return 'NOT_FOUND'",
            "end",
            "if redis.call('HGET', KEYS[1], 'terminal') == '1' then",
            "  return 'TERMINAL'",
            "end",
            "local owner = redis.call('HGET', KEYS[1], 'owner')",
            "local lease_until = tonumber(redis.call('HGET', KEYS[1], 'leaseUntil') or '0')",
            "if owner and owner ~= ARGV[1] and lease_until > tonumber(ARGV[2]) then",
            "  return 'HELD'",
            "end",
            "redis.call('HSET', KEYS[1], 'owner', ARGV[1], 'leaseUntil', tostring(tonumber(ARGV[2]) + tonumber(ARGV[3])))",
            "return 'CLAIMED'"), String.class);

    private static final RedisScript<String> COMMIT = RedisScript.of(String.join("\n",
            "if redis.call('EXISTS', KEYS[1]) == 0 then",
            "  return 'NOT_FOUND'",
            "end",
            "if redis.call('HGET', KEYS[1], 'owner') ~= ARGV[1] then",
            "  return 'LEASE_LOST'",
            "end",
            "if redis.call('HGET', KEYS[1], 'version') ~= ARGV[2] then",
            "  return 'STALE'",
            "end",
            "local id = ARGV[9]",
            "local previous = redis.call('HGET', KEYS[1], 'state')",
            "redis.call('SET', KEYS[2], ARGV[3])",
            "if ARGV[6] ~= '' then",
            "  redis.call('RPUSH', KEYS[3], ARGV[6])",
            "end",
            "redis.call('SREM', ARGV[11] .. 'state:' .. previous, id)",
            "redis.call('SADD', KEYS[4], id)",
            "if ARGV[5] == '1' then",
            "  redis.call('ZREM', KEYS[5], id)",
            "else",
            "  redis.call('ZADD', KEYS[5], ARGV[10], id)",
            "end",
            "redis.call('HSET', KEYS[1], 'version', tostring(tonumber(ARGV[2]) + 1), 'state', ARGV[4],",
            "  'terminal', ARGV[5], 'leaseUntil', tostring(tonumber(ARGV[7]) + tonumber(ARGV[8])))",
            "return 'OK'"), String.class);

    private static final RedisScript<String> RELEASE = RedisScript.of(String.join("\n",
            "if redis.call('HGET', KEYS[1], 'owner') == ARGV[1] then",
            "  redis.call('HDEL', KEYS[1], 'owner', 'leaseUntil')",
            "  return 'RELEASED'",
            "end",
            "return 'NOT_OWNER'"), String.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final OrchestrationSerializer serializer;
    private final String keyPrefix;
    private final Clock clock;

    public RedisOrchestrationStore(ReactiveRedisTemplate<String, String> redisTemplate,
                                   OrchestrationSerializer serializer,
                                   String keyPrefix,
                                   Clock clock) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
        log.info("Initialized Redis orchestration store with key prefix: {}", keyPrefix);
    }

    @Override
    public Mono<CreateResult> createIfAbsent(OrchestrationRecord record) {
        return Mono.fromCallable(() -> serializer.serializeRecord(record))
                .onErrorMap(SerializationException.class, e -> new OrchestrationStoreException(e.getMessage(), e))
                .flatMap(json -> redisTemplate.execute(CREATE,
                                List.of(idemKey(record.idempotencyKey()), recordKey(record.id()), metaKey(record.id()),
                                        stateKey(record.state()), activeKey()),
                                List.of(record.id(), json, record.state().name(),
                                        String.valueOf(record.updatedAt().toEpochMilli())))
                        .next())
                .flatMap(id -> {
                    if (id.equals(record.id())) {
                        log.debug("Created orchestration {} for idempotency key {}", id, record.idempotencyKey());
                        return Mono.just(new CreateResult(record, true));
                    }
                    log.debug("Idempotency key {} already maps to orchestration {}", record.idempotencyKey(), id);
                    return findById(id)
                            .switchIfEmpty(Mono.error(() -> new OrchestrationStoreException("Idempotency key "
                                    + record.idempotencyKey() + " points at missing orchestration " + id)))
                            .map(existing -> new CreateResult(existing, false));
                })
                .onErrorMap(this::isUnexpected, e -> storeFailure("create orchestration " + record.id(), e));
    }

    @Override
    public Mono<OrchestrationRecord> findById(String orchestrationId) {
        return redisTemplate.opsForValue().get(recordKey(orchestrationId))
                .flatMap(this::readRecord);
    }

    @Override
    public Mono<OrchestrationRecord> findByIdempotencyKey(String idempotencyKey) {
        return redisTemplate.opsForValue().get(idemKey(idempotencyKey))
                .flatMap(this::findById);
    }

    @Override
    public Mono<ClaimResult> claim(String orchestrationId, String owner, Duration leaseDuration) {
        return Mono.defer(() -> redisTemplate.execute(CLAIM, List.of(metaKey(orchestrationId)),
                                List.of(owner, String.valueOf(clock.instant().toEpochMilli()),
                                        String.valueOf(leaseDuration.toMillis())))
                        .next())
                .flatMap(status -> {
                    log.debug("Claim on orchestration {} by {}: {}", orchestrationId, owner, status);
                    if ("NOT_FOUND".equals(status)) {
                        return Mono.just(ClaimResult.notFound());
                    }
                    ClaimResult.Status claimStatus = ClaimResult.Status.valueOf(status);
                    return findById(orchestrationId)
                            .map(record -> new ClaimResult(claimStatus, record))
                            .defaultIfEmpty(ClaimResult.notFound());
                })
                .onErrorMap(this::isUnexpected, e -> storeFailure("claim orchestration " + orchestrationId, e));
    }

    @Override
    public Mono<OrchestrationRecord> commit(Transition transition) {
        String id = transition.orchestrationId();
        OrchestrationRecord next = transition.next().withVersion(transition.expectedVersion() + 1);
        return Mono.fromCallable(() -> List.of(
                        serializer.serializeRecord(next),
                        transition.stepRecord() != null ? serializer.serializeStep(transition.stepRecord()) : ""))
                .onErrorMap(SerializationException.class, e -> new OrchestrationStoreException(e.getMessage(), e))
                .flatMap(json -> redisTemplate.execute(COMMIT,
                                List.of(metaKey(id), recordKey(id), stepsKey(id), stateKey(next.state()), activeKey()),
                                List.of(transition.owner(),
                                        String.valueOf(transition.expectedVersion()),
                                        json.get(0),
                                        next.state().name(),
                                        next.isTerminal() ? "1" : "0",
                                        json.get(1),
                                        String.valueOf(clock.instant().toEpochMilli()),
                                        String.valueOf(transition.leaseExtension().toMillis()),
                                        id,
                                        String.valueOf(next.updatedAt().toEpochMilli()),
                                        keyPrefix))
                        .next())
                .flatMap(status -> switch (status) {
                    case "OK" -> {
                        log.debug("Committed orchestration {} at version {} in state {}", id, next.version(), next.state());
                        yield Mono.just(next);
                    }
                    case "LEASE_LOST" -> Mono.<OrchestrationRecord>error(new LeaseLostException(id, transition.owner()));
                    case "STALE" -> Mono.<OrchestrationRecord>error(new StaleTransitionException(id, transition.expectedVersion()));
                    default -> Mono.<OrchestrationRecord>error(new OrchestrationStoreException("Orchestration " + id + " does not exist"));
                })
                .onErrorMap(this::isUnexpected, e -> storeFailure("commit orchestration " + id, e));
    }

    @Override
    public Mono<Void> release(String orchestrationId, String owner) {
        return redisTemplate.execute(RELEASE, List.of(metaKey(orchestrationId)), List.of(owner))
                .next()
                .doOnNext(status -> log.debug("Release of orchestration {} by {}: {}", orchestrationId, owner, status))
                .then();
    }

    @Override
    public Flux<StepRecord> findStepRecords(String orchestrationId) {
        return redisTemplate.opsForList().range(stepsKey(orchestrationId), 0, -1)
                .concatMap(json -> Mono.fromCallable(() -> serializer.deserializeStep(json))
                        .onErrorMap(SerializationException.class, e -> new OrchestrationStoreException(e.getMessage(), e)));
    }

    @Override
    public Flux<OrchestrationRecord> findByState(OrchestrationState state) {
        return redisTemplate.opsForSet().members(stateKey(state))
                .concatMap(this::findById);
    }

    @Override
    public Flux<OrchestrationRecord> findStale(Instant updatedBefore) {
        Range<Double> range = Range.of(Range.Bound.unbounded(),
                Range.Bound.exclusive((double) updatedBefore.toEpochMilli()));
        return redisTemplate.opsForZSet().rangeByScore(activeKey(), range)
                .concatMap(this::findById)
                .filter(record -> !record.isTerminal())
                .doOnSubscribe(subscription -> log.debug("Scanning Redis for orchestrations updated before {}", updatedBefore));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return redisTemplate.opsForValue()
                .set(keyPrefix + "health:check", "ok", Duration.ofSeconds(10))
                .doOnNext(result -> log.debug("Redis health check result: {}", result))
                .onErrorResume(error -> {
                    log.warn("Redis health check failed", error);
                    return Mono.just(false);
                });
    }

    @Override
    public StoreType getStoreType() {
        return StoreType.REDIS;
    }

    private Mono<OrchestrationRecord> readRecord(String json) {
        return Mono.fromCallable(() -> serializer.deserializeRecord(json))
                .onErrorMap(SerializationException.class, e -> new OrchestrationStoreException(e.getMessage(), e));
    }

    private boolean isUnexpected(Throwable error) {
        return !(error instanceof OrchestrationStoreException);
    }

    private OrchestrationStoreException storeFailure(String operation, Throwable cause) {
        log.error("Redis store failed to {}", operation, cause);
        return new OrchestrationStoreException("Failed to " + operation, cause);
    }

    private String recordKey(String id) {
        return keyPrefix + "record:" + id;
    }

    private String metaKey(String id) {
        return keyPrefix + "meta:" + id;
    }

    private String stepsKey(String id) {
        return keyPrefix + "steps:" + id;
    }

    private String idemKey(String idempotencyKey) {
        return keyPrefix + "idem:" + idempotencyKey;
    }

    private String stateKey(OrchestrationState state) {
        return keyPrefix + "state:" + state.name();
    }

    private String activeKey() {
        return keyPrefix + "active";
    }
}
