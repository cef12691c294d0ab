package com.layoutparser.generator.collaborator;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LayoutIds;

/**
 * Get-or-populate cache in front of another layout store. Misses are not cached.
 */
public class CachingLayoutStore implements LayoutStore {

    private static final Logger log = LoggerFactory.getLogger(CachingLayoutStore.class);

    private final LayoutStore delegate;
    private final Map<String, Layout> cache = new ConcurrentHashMap<>();

    public CachingLayoutStore(LayoutStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<Layout> fetch(String idOrName) {
        String key = LayoutIds.normalize(idOrName);
        Layout cached = cache.get(key);
        if (cached != null) {
            log.debug("Layout cache hit for {}", idOrName);
            return Optional.of(cached);
        }
        Optional<Layout> loaded = delegate.fetch(idOrName);
        loaded.ifPresent(layout -> cache.putIfAbsent(key, layout));
        return loaded;
    }

    @Override
    public List<Layout> search(String term, int maxResults) {
        return delegate.search(term, maxResults);
    }

    public void invalidate() {
        cache.clear();
    }
}
