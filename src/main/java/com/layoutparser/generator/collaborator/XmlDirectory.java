package com.layoutparser.generator.collaborator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import com.layoutparser.generator.exception.CollaboratorException;

/**
 * Lists and reads the XML documents of a store directory, decrypting stored ciphertext.
 */
class XmlDirectory {

    private final String collaborator;
    private final Path directory;
    private final Decryptor decryptor;

    XmlDirectory(String collaborator, Path directory, Decryptor decryptor) {
        this.collaborator = collaborator;
        this.directory = directory;
        this.decryptor = decryptor;
    }

    List<Path> files() {
        if (!Files.isDirectory(directory)) {
            throw new CollaboratorException(collaborator, "directory does not exist: " + directory);
        }
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xml"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new CollaboratorException(collaborator, "cannot list " + directory, e);
        }
    }

    String read(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8).strip();
            if (!content.isEmpty() && content.charAt(0) == '\uFEFF') {
                content = content.substring(1);
            }
            return content.startsWith("<") ? content : decryptor.decrypt(content);
        } catch (IOException e) {
            throw new CollaboratorException(collaborator, "cannot read " + file, e);
        }
    }

    Path getDirectory() {
        return directory;
    }
}
