package com.hits.service.core.counter;

import com.hits.service.core.config.HitsProperties;
import org.springframework.stereotype.Component;

@Component
public class HitKeyValidator {

    private final HitsProperties properties;

    public HitKeyValidator(HitsProperties properties) {
        this.properties = properties;
    }

    /**
     * Returns {@code key} unchanged when it is usable as a counter key.
     *
     * @throws InvalidKeyException if the key is null, blank, too long or contains control characters
     */
    public String validate(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidKeyException("key is required");
        }
        int maxLength = properties.getKeys().getMaxLength();
        if (maxLength > 0 && key.length() > maxLength) {
            throw new InvalidKeyException("key exceeds " + maxLength + " characters");
        }
        if (key.chars().anyMatch(Character::isISOControl)) {
            throw new InvalidKeyException("key must not contain control characters");
        }
        return key;
    }
}
