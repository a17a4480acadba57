package io.flowcraft.core.template;

import java.io.Serial;
import java.util.List;

/// Thrown when a template or predicate references a path that resolves to nothing.
///
/// Carries the offending path, the nearest valid alternative (if any within
/// edit distance 2) and every path that would have resolved.
public class TemplateResolutionException extends RuntimeException {
    @Serial private static final long serialVersionUID = 1870266125304711512L;

    private final String path;
    private final String suggestion;
    private final List<String> validPaths;

    public TemplateResolutionException(String path, String suggestion, List<String> validPaths) {
        super(buildMessage(path, suggestion, validPaths));
        this.path = path;
        this.suggestion = suggestion;
        this.validPaths = List.copyOf(validPaths);
    }

    private static String buildMessage(String path, String suggestion, List<String> validPaths) {
        StringBuilder sb = new StringBuilder("Variable '{").append(path).append("}' not found");
        if (suggestion != null) {
            sb.append(". Did you mean '").append(suggestion).append("'?");
        }
        sb.append(" Valid paths: ").append(validPaths);
        return sb.toString();
    }

    public String getPath() {
        return path;
    }

    /// Returns the nearest valid path, or null when none is close enough.
    public String getSuggestion() {
        return suggestion;
    }

    public List<String> getValidPaths() {
        return validPaths;
    }
}
