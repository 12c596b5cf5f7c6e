package com.reprise.service.canonicalization;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes questions for stable cache keys.
 *
 * Steps:
 * 1. Case-fold
 * 2. Trim and collapse whitespace runs to a single space
 * 3. SHA-256 of the result is the fingerprint
 *
 * Target: "  Hello   World " and "hello world" share one cache entry.
 */
@Service
public class QueryNormalizer {

    /**
     * @param query raw question, may be null
     * @return normalized question, never null
     */
    public String normalize(String query) {
        if (query == null) {
            return "";
        }
        return StringUtils.normalizeSpace(query.toLowerCase(Locale.ROOT));
    }

    /**
     * @param normalizedQuery output of {@link #normalize(String)}
     * @return SHA-256 hash (64 hex chars)
     */
    public String fingerprint(String normalizedQuery) {
        return DigestUtils.sha256Hex(normalizedQuery);
    }

    /**
     * Whitespace tokens of the case-folded text, in first-seen order.
     */
    public Set<String> tokenize(String text) {
        if (text == null) {
            return Set.of();
        }
        String[] tokens = StringUtils.split(text.toLowerCase(Locale.ROOT));
        return new LinkedHashSet<>(Arrays.asList(tokens));
    }
}
