package com.geoinsight.mcp.service;

import com.geoinsight.mcp.client.EmbeddingClient;
import com.geoinsight.mcp.client.QueryTranslator;
import com.geoinsight.mcp.config.QueryCacheProperties;
import com.geoinsight.mcp.config.TranslatorPromptLoader;
import com.geoinsight.mcp.exception.InvalidArgumentException;
import com.geoinsight.mcp.exception.UpstreamUnavailableException;
import com.geoinsight.mcp.model.CacheOutcome;
import com.geoinsight.mcp.model.CacheResolution;
import com.geoinsight.mcp.model.QueryMappingEntry;
import com.geoinsight.mcp.model.StructuredQuery;
import com.geoinsight.mcp.repository.QueryMappingRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Maps free-text requests to structured queries: exact fingerprint hit, then near hit by embedding
 * distance, then a translator call.
 *
 * <p>Entries are only valid under the current schema version; older ones stay in the table but
 * never match. Stores are idempotent per fingerprint: the first validated translation is kept and
 * later writers only touch {@code updated_at}. A translator failure never fails the caller; it
 * yields the empty default query and stores nothing.
 *
 * <p>Lifecycle: the index is loaded from the table at startup, and pending alias writes are
 * flushed at shutdown.
 */
@Service
@Slf4j
public class SemanticQueryCacheService {

    private final QueryMappingRepository repository;
    private final VectorIndex vectorIndex;
    private final EmbeddingClient embeddingClient;
    private final QueryTranslator translator;
    private final TranslatorPromptLoader promptLoader;
    private final QueryCacheProperties properties;
    private final Validator validator;
    private final CacheMetricsService metrics;

    static final int STORE_LOCK_STRIPES = 64;

    private final ReentrantLock[] storeLocks = new ReentrantLock[STORE_LOCK_STRIPES];
    private final ExecutorService aliasWriter = Executors.newSingleThreadExecutor(daemon("query-cache-writer"));
    private final ExecutorService translatorCalls = Executors.newCachedThreadPool(daemon("query-translator"));

    public SemanticQueryCacheService(QueryMappingRepository repository,
                                     VectorIndex vectorIndex,
                                     EmbeddingClient embeddingClient,
                                     QueryTranslator translator,
                                     TranslatorPromptLoader promptLoader,
                                     QueryCacheProperties properties,
                                     Validator validator,
                                     CacheMetricsService metrics) {
        this.repository = repository;
        this.vectorIndex = vectorIndex;
        this.embeddingClient = embeddingClient;
        this.translator = translator;
        this.promptLoader = promptLoader;
        this.properties = properties;
        this.validator = validator;
        this.metrics = metrics;
        for (int i = 0; i < storeLocks.length; i++) {
            storeLocks[i] = new ReentrantLock();
        }
    }

    @PostConstruct
    public void loadIndex() {
        try {
            List<QueryMappingEntry> entries =
                    repository.findBySchemaVersionAndEmbeddingIsNotNull(properties.getSchemaVersion());
            int loaded = 0;
            for (QueryMappingEntry entry : entries) {
                double[] vector = EmbeddingVectors.parse(entry.getEmbedding());
                if (vector != null && vector.length > 0) {
                    vectorIndex.insert(entry.getRequestHash(), vector);
                    loaded++;
                }
            }
            log.info("✅ Semantic cache index loaded: {} entries (schema v{})", loaded, properties.getSchemaVersion());
        } catch (DataAccessException e) {
            log.warn("⚠️  Could not load query mapping cache, starting with an empty index: {}", e.getMessage());
        }
    }

    public CacheResolution resolve(String requestText) {
        String normalized = QueryFingerprint.normalize(requestText);
        if (normalized.isEmpty()) {
            throw new InvalidArgumentException("request text is empty");
        }
        String fingerprint = QueryFingerprint.fingerprint(normalized, properties.getParserModel(),
                promptLoader.getTemplateHash(), properties.getSchemaVersion());
        String preview = normalized.substring(0, Math.min(60, normalized.length()));

        Optional<QueryMappingEntry> exact = findEntry(fingerprint).filter(this::isCurrent);
        if (exact.isPresent()) {
            log.info("🎯 Query cache exact hit [{}] '{}'", shortHash(fingerprint), preview);
            metrics.recordOutcome(CacheOutcome.EXACT_HIT);
            return CacheResolution.builder()
                    .outcome(CacheOutcome.EXACT_HIT)
                    .structuredQuery(exact.get().getStructuredQuery())
                    .fingerprint(fingerprint)
                    .build();
        }

        double[] vector = embed(normalized);
        if (vector != null) {
            Optional<CacheResolution> near = nearHit(fingerprint, normalized, vector);
            if (near.isPresent()) {
                log.info("🎯 Query cache near hit [{}] -> [{}] distance={} '{}'", shortHash(fingerprint),
                        shortHash(near.get().getMatchedFingerprint()), near.get().getDistance(), preview);
                metrics.recordOutcome(CacheOutcome.NEAR_HIT);
                return near.get();
            }
        }

        StructuredQuery translated;
        try {
            translated = translate(normalized);
        } catch (UpstreamUnavailableException e) {
            log.warn("⚠️  Query cache miss with translator unavailable, using default scope: {}", e.getMessage());
            metrics.recordTranslatorFailure();
            metrics.recordOutcome(CacheOutcome.MISS_FALLBACK);
            return CacheResolution.builder()
                    .outcome(CacheOutcome.MISS_FALLBACK)
                    .structuredQuery(StructuredQuery.empty())
                    .fingerprint(fingerprint)
                    .fallback(true)
                    .translatorError(e.getMessage())
                    .retryable(true)
                    .build();
        }

        StructuredQuery stored = store(fingerprint, normalized, vector, translated, null);
        log.info("📝 Query cache miss [{}] translated and stored '{}'", shortHash(fingerprint), preview);
        metrics.recordOutcome(CacheOutcome.MISS);
        return CacheResolution.builder()
                .outcome(CacheOutcome.MISS)
                .structuredQuery(stored)
                .fingerprint(fingerprint)
                .build();
    }

    private Optional<CacheResolution> nearHit(String fingerprint, String normalized, double[] vector) {
        List<VectorMatch> matches;
        try {
            matches = vectorIndex.query(vector, properties.getTopK());
        } catch (DataAccessException e) {
            log.warn("⚠️  Vector index query failed, skipping near-hit search: {}", e.getMessage());
            return Optional.empty();
        }

        for (VectorMatch match : matches) {
            if (match.getDistance() > properties.getMaxDistance()) {
                break;
            }
            if (match.getId().equals(fingerprint)) {
                continue;
            }
            Optional<QueryMappingEntry> entry = findEntry(match.getId())
                    .filter(this::isCurrent)
                    .filter(e -> e.getStructuredQuery() != null);
            if (entry.isPresent()) {
                StructuredQuery query = entry.get().getStructuredQuery();
                recordAlias(fingerprint, normalized, vector, query, entry.get().getRequestHash());
                return Optional.of(CacheResolution.builder()
                        .outcome(CacheOutcome.NEAR_HIT)
                        .structuredQuery(query)
                        .fingerprint(fingerprint)
                        .matchedFingerprint(entry.get().getRequestHash())
                        .distance(match.getDistance())
                        .build());
            }
        }
        return Optional.empty();
    }

    private void recordAlias(String fingerprint, String normalized, double[] vector,
                             StructuredQuery query, String aliasOf) {
        aliasWriter.submit(() -> {
            try {
                store(fingerprint, normalized, vector, query, aliasOf);
                metrics.recordAliasWritten();
            } catch (RuntimeException e) {
                log.warn("⚠️  Alias [{}] of [{}] not written: {}", shortHash(fingerprint), shortHash(aliasOf), e.getMessage());
            }
        });
    }

    /**
     * Idempotent write keyed on the fingerprint.
     *
     * @return the structured query now stored under the fingerprint
     */
    StructuredQuery store(String fingerprint, String normalized, double[] vector,
                          StructuredQuery query, String aliasOf) {
        ReentrantLock lock = storeLockFor(fingerprint);
        lock.lock();
        try {
            LocalDateTime now = LocalDateTime.now();
            Optional<QueryMappingEntry> existing = repository.findById(fingerprint);

            if (existing.isPresent() && isCurrent(existing.get())) {
                QueryMappingEntry entry = existing.get();
                entry.setUpdatedAt(now);
                repository.save(entry);
                return entry.getStructuredQuery();
            }

            QueryMappingEntry entry;
            if (existing.isPresent()) {
                entry = existing.get();
                log.info("♻️  Regenerating query cache entry [{}] from schema v{} to v{}",
                        shortHash(fingerprint), entry.getSchemaVersion(), properties.getSchemaVersion());
                entry.setStructuredQuery(query);
                entry.setSchemaVersion(properties.getSchemaVersion());
                entry.setParserModel(properties.getParserModel());
                entry.setParserTemplateHash(promptLoader.getTemplateHash());
                entry.setUpdatedAt(now);
                if (vector != null) {
                    entry.setEmbedding(EmbeddingVectors.format(vector));
                }
            } else {
                entry = QueryMappingEntry.builder()
                        .requestHash(fingerprint)
                        .requestText(normalized)
                        .parserModel(properties.getParserModel())
                        .parserTemplateHash(promptLoader.getTemplateHash())
                        .schemaVersion(properties.getSchemaVersion())
                        .structuredQuery(query)
                        .embedding(vector != null ? EmbeddingVectors.format(vector) : null)
                        .aliasOf(aliasOf)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
            }

            try {
                repository.save(entry);
            } catch (DataIntegrityViolationException e) {
                // written concurrently by another instance: keep theirs
                log.info("Query cache entry [{}] written concurrently, keeping the stored one", shortHash(fingerprint));
                return repository.findById(fingerprint)
                        .map(QueryMappingEntry::getStructuredQuery)
                        .orElse(query);
            }
            if (vector != null) {
                vectorIndex.insert(fingerprint, vector);
            }
            return query;
        } catch (DataAccessException e) {
            log.warn("⚠️  Could not persist query cache entry [{}]: {}", shortHash(fingerprint), e.getMessage());
            return query;
        } finally {
            lock.unlock();
        }
    }

    /** Stores of one fingerprint always share a stripe; the stripe count bounds the locks held. */
    ReentrantLock storeLockFor(String fingerprint) {
        return storeLocks[Math.floorMod(fingerprint.hashCode(), storeLocks.length)];
    }

    private StructuredQuery translate(String normalized) {
        Future<StructuredQuery> call = translatorCalls.submit(() -> translator.translate(normalized));
        StructuredQuery query;
        try {
            query = call.get(properties.getTranslatorTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new UpstreamUnavailableException(
                    "translator timed out after " + properties.getTranslatorTimeoutMs() + "ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("interrupted while waiting for the translator", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UpstreamUnavailableException) {
                throw (UpstreamUnavailableException) cause;
            }
            throw new UpstreamUnavailableException("translator failed: " + cause.getMessage(), cause);
        }

        if (query == null) {
            throw new UpstreamUnavailableException("translator returned no structured query");
        }
        Set<ConstraintViolation<StructuredQuery>> violations = validator.validate(query);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new UpstreamUnavailableException("translator output failed validation: " + details);
        }
        try {
            StructuredQueryChecks.requireExecutable(query);
        } catch (InvalidArgumentException e) {
            throw new UpstreamUnavailableException("translator output is not executable: " + e.getMessage(), e);
        }
        return query;
    }

    private double[] embed(String normalized) {
        try {
            List<Double> embedding = embeddingClient.embed(normalized);
            if (embedding == null || embedding.isEmpty()) {
                throw new UpstreamUnavailableException("embedding service returned no vector");
            }
            return EmbeddingVectors.toArray(embedding);
        } catch (UpstreamUnavailableException e) {
            log.warn("⚠️  Embedding unavailable, near-hit search skipped: {}", e.getMessage());
            metrics.recordEmbeddingFailure();
            return null;
        }
    }

    private Optional<QueryMappingEntry> findEntry(String fingerprint) {
        try {
            return repository.findById(fingerprint);
        } catch (DataAccessException e) {
            log.warn("⚠️  Query cache lookup failed for [{}]: {}", shortHash(fingerprint), e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isCurrent(QueryMappingEntry entry) {
        return properties.getSchemaVersion().equals(entry.getSchemaVersion());
    }

    public int indexSize() {
        return vectorIndex.size();
    }

    /**
     * Blocks until every alias write queued so far has been applied.
     */
    public void flushPendingWrites() {
        try {
            aliasWriter.submit(() -> { }).get(properties.getShutdownFlushTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️  Interrupted while flushing query cache writes");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("⚠️  Query cache writes not flushed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        flushPendingWrites();
        aliasWriter.shutdown();
        translatorCalls.shutdownNow();
        log.info("Semantic query cache stopped");
    }

    private static String shortHash(String fingerprint) {
        return fingerprint == null ? "-" : fingerprint.substring(0, Math.min(12, fingerprint.length()));
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
