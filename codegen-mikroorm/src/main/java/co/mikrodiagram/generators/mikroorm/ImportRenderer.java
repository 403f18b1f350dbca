package co.mikrodiagram.generators.mikroorm;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Renders {@link CollectedImports} as TypeScript import statements.
 *
 * <p>Order: the ORM module import, then {@code import type} lines for interfaces, then
 * standalone enums, then related types. Names are sorted within each group and a name is
 * imported by the first group that holds it.
 */
public final class ImportRenderer {

    private ImportRenderer() {
    }

    public static String render(CollectedImports imports, String coreModule) {
        List<String> lines = new ArrayList<>();

        SortedSet<String> core = new TreeSet<>(imports.decorators());
        if (imports.needsCollection()) {
            core.add("Collection");
        }
        if (imports.needsCascade()) {
            core.add("Cascade");
        }
        lines.add("import { " + String.join(", ", core) + " } from \"" + coreModule + "\"");

        for (String name : imports.referencedInterfaces()) {
            lines.add("import type { " + name + " } from \"./" + name + "\"");
        }
        Set<String> imported = new HashSet<>(imports.referencedInterfaces());
        for (String name : imports.referencedEnums()) {
            if (imported.add(name)) {
                lines.add("import { " + name + " } from \"./" + name + "\"");
            }
        }
        for (String name : imports.relatedTypes()) {
            if (imported.add(name)) {
                lines.add("import { " + name + " } from \"./" + name + "\"");
            }
        }
        return String.join("\n", lines);
    }
}
