package com.layoutparser.generator.collaborator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LayoutIds;
import com.layoutparser.generator.parser.LayoutXmlParser;

/**
 * Layout store backed by a directory of layout XML files.
 */
public class DirectoryLayoutStore implements LayoutStore {

    private static final Logger log = LoggerFactory.getLogger(DirectoryLayoutStore.class);

    private final XmlDirectory directory;
    private final LayoutXmlParser parser;

    public DirectoryLayoutStore(Path directory, LayoutXmlParser parser, Decryptor decryptor) {
        this.directory = new XmlDirectory("layout-store", directory, decryptor);
        this.parser = parser;
    }

    @Override
    public Optional<Layout> fetch(String idOrName) {
        return loadAll().stream()
                .filter(l -> LayoutIds.sameLayout(l.getId(), idOrName) || l.getName().equalsIgnoreCase(idOrName))
                .findFirst();
    }

    @Override
    public List<Layout> search(String term, int maxResults) {
        String needle = term == null ? "" : term.toLowerCase(Locale.ROOT);
        return loadAll().stream()
                .filter(l -> l.getName().toLowerCase(Locale.ROOT).contains(needle)
                        || (l.getDescription() != null && l.getDescription().toLowerCase(Locale.ROOT).contains(needle)))
                .limit(maxResults)
                .toList();
    }

    private List<Layout> loadAll() {
        List<Layout> layouts = new ArrayList<>();
        for (Path file : directory.files()) {
            try {
                layouts.add(parser.parse(directory.read(file)));
            } catch (StructureException e) {
                log.warn("Skipping unreadable layout {}: {}", file.getFileName(), e.getMessage());
            }
        }
        log.debug("Loaded {} layouts from {}", layouts.size(), directory.getDirectory());
        return layouts;
    }
}
