package com.llmgateway.error;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One row of the classification table. A rule matches when any of its
 * exception types appears in the failure's cause chain, the upstream status
 * is one of its statuses, or the failure text contains one of its keywords.
 * A text containing one of its exclusions never matches.
 */
public record ErrorRule(
        ErrorKind kind,
        List<String> keywords,
        Set<Integer> statuses,
        List<Class<? extends Throwable>> types,
        List<String> exclusions
) {

    public ErrorRule {
        keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        statuses = Set.copyOf(statuses);
        types = List.copyOf(types);
        exclusions = exclusions.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * Matches on exception type alone. Types are checked for every rule
     * before any text, so a transport failure is not misread from its message.
     */
    boolean matchesType(FailureView failure) {
        if (excluded(failure)) {
            return false;
        }
        return types.stream().anyMatch(failure::hasCause);
    }

    /**
     * Matches on upstream status or failure text.
     */
    boolean matchesSignal(FailureView failure) {
        if (excluded(failure)) {
            return false;
        }
        if (failure.status() > 0 && statuses.contains(failure.status())) {
            return true;
        }
        return keywords.stream().anyMatch(keyword -> containsKeyword(failure.text(), keyword));
    }

    private boolean excluded(FailureView failure) {
        return exclusions.stream().anyMatch(failure.text()::contains);
    }

    // Numeric keywords such as "429" only count as whole words
    private static boolean containsKeyword(String text, String keyword) {
        if (keyword.chars().allMatch(Character::isDigit)) {
            return Pattern.compile("(?<![0-9])" + keyword + "(?![0-9])").matcher(text).find();
        }
        return text.contains(keyword);
    }
}
