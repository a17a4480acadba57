package io.flowcraft.core.template;

import io.flowcraft.core.state.StateContainer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Regex-based {@link TemplateResolver} with dot-path traversal.
///
/// Placeholders follow `{identifier(.identifier)*}`; braces that do not match
/// this form, such as JSON examples in a prompt, are left untouched. A leading
/// `state.` segment is stripped so `{state.topic}` and `{topic}` are
/// equivalent.
///
/// Resolved values are stringified: null becomes the empty string, everything
/// else uses `String.valueOf`.
///
/// @implNote Stateless and thread-safe.
public class PathTemplateResolver implements TemplateResolver {

    private static final Pattern VARIABLE_PATTERN =
            Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_.]*)}");
    private static final String STATE_PREFIX = "state.";
    private static final Object MISSING = new Object();

    @Override
    public String resolve(String template, Map<String, ?> inputs, StateContainer state) {
        if (template == null) {
            return "";
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            Object value = lookup(matcher.group(1), inputs, state);
            String replacement = value != null ? String.valueOf(value) : "";
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /// Returns the placeholder paths of a template in order of appearance.
    ///
    /// @param template template text, may be null
    /// @return paths as written, including any `state.` prefix, never null
    public static List<String> placeholders(String template) {
        List<String> paths = new ArrayList<>();
        if (template == null) {
            return paths;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        while (matcher.find()) {
            paths.add(matcher.group(1));
        }
        return paths;
    }

    @Override
    public Object lookup(String path, Map<String, ?> inputs, StateContainer state) {
        Object value = find(path, inputs, state);
        if (value == MISSING) {
            List<String> valid = validPaths(inputs, state);
            throw new TemplateResolutionException(
                    path, PathSuggester.suggest(stripPrefix(path), valid).orElse(null), valid);
        }
        return value;
    }

    @Override
    public boolean canResolve(String path, Map<String, ?> inputs, StateContainer state) {
        return find(path, inputs, state) != MISSING;
    }

    private Object find(String rawPath, Map<String, ?> inputs, StateContainer state) {
        boolean explicitState = rawPath.startsWith(STATE_PREFIX);
        String path = stripPrefix(rawPath);

        if (!explicitState) {
            Object fromInputs = traverse(inputs, path);
            if (fromInputs != MISSING) {
                return fromInputs;
            }
        }
        return state.contains(path) ? state.valueAt(path) : MISSING;
    }

    private static Object traverse(Map<String, ?> root, String path) {
        Object current = root;
        for (String segment : path.split("\\.", -1)) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return MISSING;
            }
            current = map.get(segment);
        }
        return current;
    }

    private static String stripPrefix(String path) {
        return path.startsWith(STATE_PREFIX) ? path.substring(STATE_PREFIX.length()) : path;
    }

    private static List<String> validPaths(Map<String, ?> inputs, StateContainer state) {
        List<String> paths = new ArrayList<>(inputs.keySet());
        for (String path : state.paths()) {
            if (!paths.contains(path)) {
                paths.add(path);
            }
        }
        return paths;
    }
}
