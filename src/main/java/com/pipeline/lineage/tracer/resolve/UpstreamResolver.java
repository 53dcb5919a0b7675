package com.pipeline.lineage.tracer.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.index.WriterLookup;
import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.Writer;

/**
 * Resolves and memoizes the upstreams of each table for the duration of a run.
 *
 * The cache is shared by concurrently resolving targets. Each key is written once: two threads
 * may compute the same entry, but only the first result is kept.
 */
public class UpstreamResolver {
    private static final Logger log = LoggerFactory.getLogger(UpstreamResolver.class);

    private final WriterLookup writerLookup;
    private final UpstreamExtractor upstreamExtractor;
    private final WriterResolutionPolicy policy;

    private final ConcurrentMap<TableName, ResolvedUpstreams> cache = new ConcurrentHashMap<>();

    public UpstreamResolver(WriterLookup writerLookup, UpstreamExtractor upstreamExtractor,
                            WriterResolutionPolicy policy) {
        this.writerLookup = writerLookup;
        this.upstreamExtractor = upstreamExtractor;
        this.policy = policy;
    }

    public UpstreamResolver(WriterLookup writerLookup, UpstreamExtractor upstreamExtractor) {
        this(writerLookup, upstreamExtractor, StandardResolutionPolicy.UNION);
    }

    public ResolvedUpstreams resolve(TableName table) {
        ResolvedUpstreams cached = cache.get(table);
        if (cached != null) {
            return cached;
        }
        ResolvedUpstreams computed = compute(table);
        ResolvedUpstreams previous = cache.putIfAbsent(table, computed);
        return previous != null ? previous : computed;
    }

    public int cachedTables() {
        return cache.size();
    }

    private ResolvedUpstreams compute(TableName table) {
        Set<Writer> writers = writerLookup.writersFor(table);
        if (writers.isEmpty()) {
            return new ResolvedUpstreams(writers, Set.of());
        }

        List<Set<TableName>> perWriter = new ArrayList<>(writers.size());
        for (Writer writer : writers) {
            Set<TableName> reads = upstreamExtractor.readTables(writer);
            log.debug("Writer {} of '{}' reads {}", writer, table, reads);
            perWriter.add(reads);
        }
        return new ResolvedUpstreams(writers, policy.combine(perWriter));
    }
}
