package com.apidocs.porter.io;

import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@NoArgsConstructor
public class XmlFileDiscoveryService {

    /**
     * Every xml file below the given directories, in a stable order.
     */
    public List<Path> discoverIntelliSenseFiles(List<Path> directories) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path dir : directories) {
            try (Stream<Path> stream = Files.walk(dir)) {
                files.addAll(stream.filter(Files::isRegularFile)
                        .filter(this::isXmlFile)
                        .sorted()
                        .collect(Collectors.toList()));
            }
        }
        return files;
    }

    /**
     * Type files of a Docs repository. Namespace files ({@code ns-*.xml}) and
     * the root {@code index.xml} describe no type and are left out.
     */
    public List<Path> discoverDocsFiles(Path docsDir) throws IOException {
        try (Stream<Path> stream = Files.walk(docsDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isXmlFile)
                    .filter(this::isTypeFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isXmlFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xml");
    }

    private boolean isTypeFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return !name.startsWith("ns-") && !name.equals("index.xml");
    }
}
