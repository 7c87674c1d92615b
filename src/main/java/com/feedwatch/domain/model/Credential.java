package com.feedwatch.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** One set of upstream API keys with its own daily request quota. */
@Getter
@Builder
@EqualsAndHashCode(of = "id")
public class Credential {

    private final String id;

    private final String apiKey;

    private final String apiSecret;

    /** First four characters of the key followed by a mask; safe to log. */
    public String maskedKey() {
        if (apiKey == null || apiKey.length() < 4) {
            return "****";
        }
        return apiKey.substring(0, 4) + "****";
    }

    @Override
    public String toString() {
        return "Credential(id=" + id + ", apiKey=" + maskedKey() + ")";
    }
}
