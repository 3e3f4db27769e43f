package org.operaton.fedlink.loader;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Keeps loaded documents for a fixed time, up to a maximum number of entries.
 * Failures are not cached.
 */
@Slf4j
public class CachingDocumentLoader implements DocumentLoader {

    private final DocumentLoader delegate;
    private final Cache<URI, RemoteDocument> cache;

    public CachingDocumentLoader(DocumentLoader delegate, Duration ttl, long maximumSize, Clock clock) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maximumSize)
            .ticker(clockTicker(clock))
            .executor(Runnable::run)
            .build();
    }

    @Override
    public RemoteDocument load(URI url) {
        RemoteDocument cached = cache.getIfPresent(url);
        if (cached != null) {
            log.debug("Using cached document for: {}", url);
            return cached;
        }

        RemoteDocument document = delegate.load(url);
        cache.put(url, document);
        return document;
    }

    public void evict(URI url) {
        cache.invalidate(url);
    }

    /**
     * Number of live entries, after expired and surplus entries have been dropped.
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        };
    }
}
