package co.mikrodiagram.generators.mikroorm;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combining name-to-source maps.
 */
public final class CodeMaps {

    private CodeMaps() {
    }

    /**
     * Merge {@code maps} in order into one map. When two maps share a key, the value from the
     * later map wins; the key keeps the position of its first appearance.
     */
    public static Map<String, String> mergeLastWins(List<Map<String, String>> maps) {
        Map<String, String> merged = new LinkedHashMap<>();
        for (Map<String, String> map : maps) {
            merged.putAll(map);
        }
        return merged;
    }
}
