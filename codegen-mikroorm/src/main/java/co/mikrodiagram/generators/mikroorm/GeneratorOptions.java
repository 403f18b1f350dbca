package co.mikrodiagram.generators.mikroorm;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings for a generation run.
 *
 * <p>{@code indentSize} is the number of spaces per indentation level; values below 1 fall
 * back to {@value #DEFAULT_INDENT_SIZE}. {@code collectionImportPath} is the module the
 * decorators, {@code Collection} and {@code Cascade} are imported from.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratorOptions(
    int indentSize,
    String collectionImportPath
) {
    public static final int DEFAULT_INDENT_SIZE = 2;
    public static final String DEFAULT_COLLECTION_IMPORT_PATH = "@mikro-orm/core";

    @JsonCreator
    public GeneratorOptions(
        @JsonProperty("indentSize") int indentSize,
        @JsonProperty("collectionImportPath") @JsonAlias("collectionImport") String collectionImportPath
    ) {
        this.indentSize = indentSize > 0 ? indentSize : DEFAULT_INDENT_SIZE;
        this.collectionImportPath = collectionImportPath != null && !collectionImportPath.isBlank()
            ? collectionImportPath
            : DEFAULT_COLLECTION_IMPORT_PATH;
    }

    public static GeneratorOptions defaults() {
        return new GeneratorOptions(DEFAULT_INDENT_SIZE, DEFAULT_COLLECTION_IMPORT_PATH);
    }

    public GeneratorOptions withIndentSize(int size) {
        return new GeneratorOptions(size, collectionImportPath);
    }

    public GeneratorOptions withCollectionImportPath(String path) {
        return new GeneratorOptions(indentSize, path);
    }
}
