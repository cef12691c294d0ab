package com.layoutparser.generator.collaborator;

import java.util.List;
import java.util.Optional;

import com.layoutparser.generator.model.Layout;

/**
 * Source of layout definitions.
 */
public interface LayoutStore {

    /**
     * Finds a layout by id (prefixes like {@code LAY_} ignored) or by name.
     */
    Optional<Layout> fetch(String idOrName);

    List<Layout> search(String term, int maxResults);
}
