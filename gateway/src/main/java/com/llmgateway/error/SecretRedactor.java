package com.llmgateway.error;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Masks credential-shaped substrings in free text before it is logged or
 * returned.
 */
public class SecretRedactor {

    static final String MASK = "****";

    private record Rule(Pattern pattern, String replacement) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("sk-[A-Za-z0-9_\\-]{20,}"), "sk-" + MASK),
            new Rule(Pattern.compile("gsk_[A-Za-z0-9]{20,}"), "gsk_" + MASK),
            new Rule(Pattern.compile("AIza[0-9A-Za-z_\\-]{30,}"), "AIza" + MASK),
            new Rule(Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._~+/\\-]{8,}=*"), "$1" + MASK),
            new Rule(Pattern.compile("(?i)([?&](?:key|api_key|apikey|access_token)=)[^&\\s\"']+"), "$1" + MASK),
            new Rule(Pattern.compile("(?i)(\"?(?:x-api-key|x-goog-api-key|api[_-]?key)\"?\\s*[:=]\\s*\"?)[^\\s\",}]{8,}"),
                    "$1" + MASK)
    );

    public String redact(String text) {
        return redact(text, List.of());
    }

    /**
     * Applies the shape rules, then masks every occurrence of the given known
     * secrets verbatim. Short values are skipped to avoid mangling ordinary words.
     */
    public String redact(String text, Collection<String> knownSecrets) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        if (knownSecrets != null) {
            for (String secret : knownSecrets) {
                if (secret != null && secret.length() >= 8) {
                    result = result.replace(secret, MASK);
                }
            }
        }
        for (Rule rule : RULES) {
            result = rule.pattern().matcher(result).replaceAll(rule.replacement());
        }
        return result;
    }
}
