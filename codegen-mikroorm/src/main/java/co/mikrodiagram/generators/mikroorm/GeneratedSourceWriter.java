package co.mikrodiagram.generators.mikroorm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes generated sources to disk as {@code <Name>.ts} files.
 */
public class GeneratedSourceWriter {

    private static final Logger log = LoggerFactory.getLogger(GeneratedSourceWriter.class);

    public static final String FILE_EXTENSION = ".ts";

    /**
     * Write every entry of {@code code} into {@code outDir}, replacing existing files.
     *
     * @return the written files, in map order
     */
    public List<Path> writeFlat(Map<String, String> code, Path outDir) throws IOException {
        Files.createDirectories(outDir);
        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, String> entry : code.entrySet()) {
            Path file = outDir.resolve(entry.getKey() + FILE_EXTENSION);
            Files.writeString(file, entry.getValue(), StandardCharsets.UTF_8);
            written.add(file);
        }
        log.info("Wrote {} files to {}", written.size(), outDir);
        return written;
    }

    /**
     * Write each category into its own sub-directory of {@code outDir}:
     * {@code entities/}, {@code embeddables/}, {@code enums/}, {@code interfaces/}.
     * Directories are only created for categories that have sources.
     */
    public List<Path> writeCategorized(CategorizedCode code, Path outDir) throws IOException {
        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> category : code.byCategory().entrySet()) {
            if (category.getValue().isEmpty()) continue;
            Path dir = outDir.resolve(category.getKey());
            Files.createDirectories(dir);
            for (Map.Entry<String, String> entry : category.getValue().entrySet()) {
                Path file = dir.resolve(entry.getKey() + FILE_EXTENSION);
                Files.writeString(file, entry.getValue(), StandardCharsets.UTF_8);
                written.add(file);
            }
        }
        log.info("Wrote {} files to {}", written.size(), outDir);
        return written;
    }
}
