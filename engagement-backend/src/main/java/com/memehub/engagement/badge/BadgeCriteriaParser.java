package com.memehub.engagement.badge;

import com.memehub.engagement.badge.criteria.AllOfCriteria;
import com.memehub.engagement.badge.criteria.RankCriteria;
import com.memehub.engagement.badge.criteria.StreakCriteria;
import com.memehub.engagement.badge.criteria.ThresholdCriteria;
import com.memehub.engagement.entity.Rank;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns criteria descriptors into {@link BadgeCriteria}.
 *
 * Grammar:
 * <pre>
 *   criteria   := all | comparison
 *   all        := "all(" criteria ("," criteria)* ")"
 *   comparison := name ">=" value
 * </pre>
 * name is a {@link Counter} descriptor name, "login_streak" or "rank";
 * value is a non-negative integer, or a {@link Rank} constant for "rank".
 */
@Component
public class BadgeCriteriaParser {

    private static final String ALL_PREFIX = "all(";
    private static final String GTE = ">=";

    // descriptor -> parsed criteria
    private final Map<String, BadgeCriteria> cache = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if the descriptor is malformed
     */
    public BadgeCriteria parse(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            throw new IllegalArgumentException("Badge criteria descriptor is empty");
        }
        return cache.computeIfAbsent(descriptor.trim(), this::parseExpression);
    }

    private BadgeCriteria parseExpression(String expression) {
        String text = expression.trim();
        if (text.toLowerCase(Locale.ROOT).startsWith(ALL_PREFIX)) {
            if (!text.endsWith(")")) {
                throw new IllegalArgumentException("Unclosed all(...) in: " + expression);
            }
            String inner = text.substring(ALL_PREFIX.length(), text.length() - 1);
            List<BadgeCriteria> parts = new ArrayList<>();
            for (String part : splitTopLevel(inner, expression)) {
                parts.add(parseExpression(part));
            }
            return new AllOfCriteria(parts);
        }
        return parseComparison(text);
    }

    private BadgeCriteria parseComparison(String text) {
        int idx = text.indexOf(GTE);
        if (idx <= 0) {
            throw new IllegalArgumentException("Expected '<name> >= <value>' but got: " + text);
        }
        String name = text.substring(0, idx).trim().toLowerCase(Locale.ROOT);
        String value = text.substring(idx + GTE.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Missing value in: " + text);
        }

        if (RankCriteria.DESCRIPTOR_NAME.equals(name)) {
            try {
                return new RankCriteria(Rank.valueOf(value.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown rank '" + value + "' in: " + text, e);
            }
        }
        long number = parseNumber(value, text);
        if (StreakCriteria.DESCRIPTOR_NAME.equals(name)) {
            return new StreakCriteria(Math.toIntExact(number));
        }
        Counter counter = Counter.fromDescriptorName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown statistic '" + name + "' in: " + text));
        return new ThresholdCriteria(counter, number);
    }

    private long parseNumber(String value, String text) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number '" + value + "' in: " + text, e);
        }
    }

    // splits on commas that are not nested inside parentheses
    private List<String> splitTopLevel(String inner, String expression) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new IllegalArgumentException("Unbalanced parentheses in: " + expression);
                }
            } else if (c == ',' && depth == 0) {
                parts.add(inner.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced parentheses in: " + expression);
        }
        parts.add(inner.substring(start));
        for (String part : parts) {
            if (part.isBlank()) {
                throw new IllegalArgumentException("Empty criterion inside all(...) in: " + expression);
            }
        }
        return parts;
    }
}
