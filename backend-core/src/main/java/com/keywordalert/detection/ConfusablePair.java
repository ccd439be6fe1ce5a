package com.keywordalert.detection;

import com.keywordalert.exception.KeywordConfigurationException;

/**
 * A (token, keyword) pair that is lexically close but must never be reported as a match.
 */
public record ConfusablePair(String token, String keyword) {

    public static ConfusablePair parse(String value) {
        int idx = value == null ? -1 : value.indexOf(':');
        if (idx <= 0 || idx == value.length() - 1) {
            throw new KeywordConfigurationException("Confusable pair must look like 'token:keyword', got: " + value);
        }
        return new ConfusablePair(value.substring(0, idx).trim(), value.substring(idx + 1).trim());
    }
}
