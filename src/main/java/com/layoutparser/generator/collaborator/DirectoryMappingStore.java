package com.layoutparser.generator.collaborator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.LayoutIds;
import com.layoutparser.generator.model.Mapping;
import com.layoutparser.generator.parser.MapperXmlParser;

/**
 * Mapping store backed by a directory of mapper XML files.
 */
public class DirectoryMappingStore implements MappingStore {

    private static final Logger log = LoggerFactory.getLogger(DirectoryMappingStore.class);

    private final XmlDirectory directory;
    private final MapperXmlParser parser;

    public DirectoryMappingStore(Path directory, MapperXmlParser parser, Decryptor decryptor) {
        this.directory = new XmlDirectory("mapping-store", directory, decryptor);
        this.parser = parser;
    }

    @Override
    public Optional<Mapping> fetchByInputLayout(String layoutId) {
        return find(layoutId, Mapping::getInputLayoutId);
    }

    @Override
    public Optional<Mapping> fetchByTargetLayout(String layoutId) {
        return find(layoutId, Mapping::getTargetLayoutId);
    }

    private Optional<Mapping> find(String layoutId, Function<Mapping, String> side) {
        return loadAll().stream().filter(m -> LayoutIds.sameLayout(side.apply(m), layoutId)).findFirst();
    }

    private List<Mapping> loadAll() {
        List<Mapping> mappings = new ArrayList<>();
        for (Path file : directory.files()) {
            try {
                mappings.add(parser.parse(directory.read(file)));
            } catch (StructureException e) {
                log.warn("Skipping unreadable mapper {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return mappings;
    }
}
