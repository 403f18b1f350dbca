package co.mikrodiagram.generators.mikroorm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generated sources split by node kind, each map keyed by sanitized name in diagram order.
 */
public record CategorizedCode(
    Map<String, String> entities,
    Map<String, String> embeddables,
    Map<String, String> enums,
    Map<String, String> interfaces
) {
    /** Directory names used when the categories are laid out on disk. */
    public static final List<String> CATEGORY_NAMES = List.of("entities", "embeddables", "enums", "interfaces");

    public CategorizedCode {
        entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        embeddables = Collections.unmodifiableMap(new LinkedHashMap<>(embeddables));
        enums = Collections.unmodifiableMap(new LinkedHashMap<>(enums));
        interfaces = Collections.unmodifiableMap(new LinkedHashMap<>(interfaces));
    }

    /** Categories in {@link #CATEGORY_NAMES} order, keyed by category name. */
    public Map<String, Map<String, String>> byCategory() {
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        result.put("entities", entities);
        result.put("embeddables", embeddables);
        result.put("enums", enums);
        result.put("interfaces", interfaces);
        return result;
    }

    /** Flatten into a single map; see {@link CodeMaps#mergeLastWins(List)} for collisions. */
    public Map<String, String> merged() {
        return CodeMaps.mergeLastWins(List.of(entities, embeddables, enums, interfaces));
    }

    public int size() {
        return entities.size() + embeddables.size() + enums.size() + interfaces.size();
    }
}
