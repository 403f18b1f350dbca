package co.mikrodiagram.generators.mikroorm;

import co.mikrodiagram.core.DiagramLoader;
import co.mikrodiagram.core.export.JsonSchemaExporter;
import co.mikrodiagram.core.model.DiagramFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * CLI entry point for the MikroORM code generator.
 *
 * Usage:
 *   java -jar codegen-mikroorm.jar --diagram <json> --output <dir> [--options <json>] [--layout flat|categorized] [--json-schema <path>]
 *   java -jar codegen-mikroorm.jar --diagram-file <path> --output <dir> [--options <json>] [--layout flat|categorized] [--json-schema <path>]
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String USAGE = "Usage: java -jar codegen-mikroorm.jar [--diagram <json> | --diagram-file <path>] "
        + "--output <dir> [--options <json>] [--layout flat|categorized] [--json-schema <path>]";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Run the generator with command-line arguments.
     *
     * @return the process exit code
     */
    static int run(String[] args) {
        try {
            String diagramJson = null;
            String diagramFile = null;
            String outputDir = null;
            String optionsJson = null;
            String layout = "categorized";
            String jsonSchemaFile = null;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--diagram":
                        diagramJson = args[++i];
                        break;
                    case "--diagram-file":
                        diagramFile = args[++i];
                        break;
                    case "--output":
                        outputDir = args[++i];
                        break;
                    case "--options":
                        optionsJson = args[++i];
                        break;
                    case "--layout":
                        layout = args[++i];
                        break;
                    case "--json-schema":
                        jsonSchemaFile = args[++i];
                        break;
                    default:
                        // Skip unknown args
                        break;
                }
            }

            boolean hasDiagramInput = diagramJson != null || diagramFile != null;
            if (!hasDiagramInput || outputDir == null) {
                System.err.println(USAGE);
                return 1;
            }
            if (!"flat".equals(layout) && !"categorized".equals(layout)) {
                System.err.println("Error: unknown layout '" + layout + "'");
                System.err.println(USAGE);
                return 1;
            }

            DiagramFile diagram = diagramFile != null
                ? DiagramLoader.load(Path.of(diagramFile))
                : DiagramLoader.parse(diagramJson);

            GeneratorOptions options = GeneratorOptions.defaults();
            if (optionsJson != null && !optionsJson.isEmpty()) {
                options = MAPPER.readValue(optionsJson, GeneratorOptions.class);
            }
            log.debug("Generator options: {}", options);

            MikroOrmGenerator generator = new MikroOrmGenerator();
            GeneratedSourceWriter writer = new GeneratedSourceWriter();
            Path out = Paths.get(outputDir);

            CategorizedCode code = generator.generateCategorized(diagram.nodes(), diagram.edges(), options);
            List<Path> written = "flat".equals(layout)
                ? writer.writeFlat(code.merged(), out)
                : writer.writeCategorized(code, out);

            if (jsonSchemaFile != null) {
                String schema = new JsonSchemaExporter().export(diagram.nodes(), diagram.edges(), options.indentSize());
                Path schemaPath = Path.of(jsonSchemaFile);
                if (schemaPath.getParent() != null) {
                    Files.createDirectories(schemaPath.getParent());
                }
                Files.writeString(schemaPath, schema, StandardCharsets.UTF_8);
                log.info("Wrote JSON schema to {}", schemaPath);
            }

            System.out.println("Generated MikroORM code for " + written.size() + " type(s) in " + outputDir);
            for (Map.Entry<String, Map<String, String>> category : code.byCategory().entrySet()) {
                for (String name : category.getValue().keySet()) {
                    System.out.println("  - " + category.getKey() + "/" + name);
                }
            }
            return 0;

        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
