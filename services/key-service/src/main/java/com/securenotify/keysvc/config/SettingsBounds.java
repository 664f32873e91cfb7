package com.securenotify.keysvc.config;

import lombok.extern.slf4j.Slf4j;

/**
 * Clamps numeric settings to their allowed range.
 * Values below the minimum fall back to the default, values above the maximum are capped.
 */
@Slf4j
public final class SettingsBounds {

    private SettingsBounds() {
    }

    public static int bounded(String name, int value, int defaultValue, int min, int max) {
        if (value < min) {
            log.warn("Setting {}={} is below minimum {}, using default {}", name, value, min, defaultValue);
            return defaultValue;
        }
        if (value > max) {
            log.warn("Setting {}={} exceeds maximum {}, capping", name, value, max);
            return max;
        }
        return value;
    }
}
