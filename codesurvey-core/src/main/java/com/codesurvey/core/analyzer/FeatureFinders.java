package com.codesurvey.core.analyzer;

import com.codesurvey.core.util.Names;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Factory and combinators for {@link FeatureFinder} instances.
 *
 * <pre>{@code
 * FeatureFinder<String> forLoop = FeatureFinders.regex("for", "\\bfor\\b");
 * FeatureFinder<String> whileLoop = FeatureFinders.regex("while", "\\bwhile\\b");
 * FeatureFinder<String> loop = FeatureFinders.union("loop", List.of(forLoop, whileLoop));
 * }</pre>
 */
public final class FeatureFinders {

    private FeatureFinders() {
        // Utility class
    }

    /**
     * Wraps a function as a named finder.
     *
     * @param name feature name
     * @param function function producing the outcome
     * @param <T> code representation type
     * @return named finder
     */
    public static <T> FeatureFinder<T> of(String name, Function<T, Feature> function) {
        Names.requireName(name, "Feature");
        Objects.requireNonNull(function, "function must not be null");
        return new FeatureFinder<>() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Feature find(T code) {
                return Objects.requireNonNull(function.apply(code),
                    () -> "Feature finder \"" + name + "\" returned null");
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    /**
     * Finder reporting one occurrence per regex match in the text, with 1-based
     * {@code line} and {@code column} and the matched text.
     *
     * @param name feature name
     * @param regex regular expression
     * @return named finder over source text
     */
    public static FeatureFinder<String> regex(String name, String regex) {
        Pattern pattern = Pattern.compile(regex, Pattern.MULTILINE);
        return of(name, text -> Feature.occurrences(findMatches(pattern, text)));
    }

    /**
     * Finder returning the union of the occurrences of the given finders.
     *
     * <p>The outcome is skipped only if every finder skips the unit; otherwise the
     * occurrences of all non-skipped outcomes are concatenated in finder order.
     *
     * @param name feature name
     * @param finders finders to combine
     * @param <T> code representation type
     * @return named finder
     */
    public static <T> FeatureFinder<T> union(String name, List<FeatureFinder<T>> finders) {
        List<FeatureFinder<T>> members = List.copyOf(finders);
        return of(name, code -> {
            List<Feature> results = members.stream().map(finder -> finder.find(code)).toList();
            if (results.stream().allMatch(Feature::isSkipped)) {
                return Feature.skipped();
            }
            List<Map<String, Object>> occurrences = new ArrayList<>();
            results.forEach(result -> occurrences.addAll(result.occurrences()));
            return Feature.occurrences(occurrences);
        });
    }

    private static List<Map<String, Object>> findMatches(Pattern pattern, String text) {
        List<Map<String, Object>> occurrences = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        int line = 1;
        int lineStart = 0;
        int scanned = 0;
        while (matcher.find()) {
            // Matches arrive in order, so only the text since the previous match is scanned.
            for (int i = scanned; i < matcher.start(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    lineStart = i + 1;
                }
            }
            scanned = matcher.start();
            Map<String, Object> occurrence = new LinkedHashMap<>();
            occurrence.put("line", line);
            occurrence.put("column", matcher.start() - lineStart + 1);
            occurrence.put("match", matcher.group());
            occurrences.add(occurrence);
        }
        return occurrences;
    }
}
