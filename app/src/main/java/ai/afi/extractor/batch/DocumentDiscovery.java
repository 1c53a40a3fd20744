package ai.afi.extractor.batch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the documents of an input directory in case-insensitive name order.
 */
public class DocumentDiscovery {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of("docx", "pdf");
    private static final String LOCK_FILE_PREFIX = "~$";

    public List<Path> discover(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Input directory does not exist: " + directory);
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(DocumentDiscovery::isEligible)
                    .sorted(Comparator.comparing(path -> lowerCaseName(path)))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list documents in " + directory, ex);
        }
    }

    static boolean isEligible(Path path) {
        String name = path.getFileName().toString();
        if (name.startsWith(LOCK_FILE_PREFIX)) {
            return false;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SUPPORTED_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static String lowerCaseName(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT);
    }
}
