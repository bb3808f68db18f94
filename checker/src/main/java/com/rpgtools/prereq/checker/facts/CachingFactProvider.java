package com.rpgtools.prereq.checker.facts;

import com.rpgtools.prereq.checker.FactProvider;
import com.rpgtools.prereq.requirement.PossessionFilter;
import com.rpgtools.prereq.requirement.walker.ReferencedFacts;
import com.rpgtools.prereq.requirement.walker.TagRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoises every answer of a delegate provider for the lifetime of this instance. Failed queries are
 * not cached. Wrap a provider per character per batch, not for longer than its facts stay unchanged.
 */
public final class CachingFactProvider implements FactProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingFactProvider.class);

    private final FactProvider delegate;
    private final Map<String, OptionalInt> traits = new ConcurrentHashMap<>();
    private final Map<MatchKey, Boolean> matches = new ConcurrentHashMap<>();
    private final Map<TagKey, Integer> counts = new ConcurrentHashMap<>();

    private record MatchKey(String collection, PossessionFilter filter) {
    }

    private record TagKey(String collection, String tag) {
    }

    public CachingFactProvider(FactProvider delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public OptionalInt getTrait(String name) {
        return traits.computeIfAbsent(name, delegate::getTrait);
    }

    @Override
    public boolean hasMatch(String collection, PossessionFilter filter) {
        return matches.computeIfAbsent(new MatchKey(collection, filter), k -> delegate.hasMatch(k.collection(), k.filter()));
    }

    @Override
    public int countTagged(String collection, String tag) {
        return counts.computeIfAbsent(new TagKey(collection, tag), k -> delegate.countTagged(k.collection(), k.tag()));
    }

    @Override
    public String identity() {
        return delegate.identity();
    }

    /**
     * Loads the traits and tag counts a requirement tree will ask for. Possession queries depend on the
     * full filter and are left to evaluation.
     */
    public CachingFactProvider prefetch(ReferencedFacts facts) {
        facts.traits().forEach(this::getTrait);
        for (TagRef ref : facts.taggedCollections()) countTagged(ref.collection(), ref.tag());
        log.debug("Prefetched {} traits and {} tag counts for {}", facts.traits().size(), facts.taggedCollections().size(), identity());
        return this;
    }

    public int cachedQueries() {
        return traits.size() + matches.size() + counts.size();
    }
}
