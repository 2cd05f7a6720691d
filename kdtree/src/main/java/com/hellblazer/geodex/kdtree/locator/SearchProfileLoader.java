/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Geodex.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.geodex.kdtree.locator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.geodex.common.IndexException.ConfigurationException;
import com.hellblazer.geodex.kdtree.locator.SearchProfile.RadiusPolicy;
import com.hellblazer.geodex.kdtree.locator.SearchProfile.SearchFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Loads named {@link SearchProfile}s from JSON.
 * <p>
 * The document holds a {@code search_profiles} object mapping profile names to objects with the optional fields
 * {@code function}, {@code radiusPolicy}, {@code initialRadius}, {@code multiplier}, {@code verify} and
 * {@code distanceLimit}. Absent fields take the values of {@link SearchProfile#defaults()}. A negative
 * {@code initialRadius} selects the fixed radius policy with its absolute value. Profiles that fail validation,
 * including fields of the wrong JSON type, are skipped with a warning.
 *
 * @author hal.hildebrand
 */
public class SearchProfileLoader {
    public static final String PROFILE_RESOURCE = "/search-profiles.json";

    private static final Logger log = LoggerFactory.getLogger(SearchProfileLoader.class);

    private final ObjectMapper               objectMapper = new ObjectMapper();
    private final Map<String, SearchProfile> profiles     = new HashMap<>();

    /**
     * Load the profiles bundled on the classpath
     */
    public SearchProfileLoader() {
        try (InputStream is = getClass().getResourceAsStream(PROFILE_RESOURCE)) {
            if (is == null) {
                log.warn("Profile resource not found: {}", PROFILE_RESOURCE);
                return;
            }
            load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load search profiles from " + PROFILE_RESOURCE, e);
        }
    }

    /**
     * Load profiles from a stream. The stream is not closed.
     */
    public SearchProfileLoader(InputStream is) throws IOException {
        load(is);
    }

    public Map<String, SearchProfile> loadAllProfiles() {
        return new HashMap<>(profiles);
    }

    public Optional<SearchProfile> loadProfile(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        var profile = profiles.get(normalizeKey(name));
        if (profile == null) {
            log.debug("Profile not found: {}", name);
        }
        return Optional.ofNullable(profile);
    }

    private void load(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        var entries = root == null ? null : root.get("search_profiles");
        if (entries == null || !entries.isObject()) {
            throw new ConfigurationException("Invalid profile format: missing search_profiles object");
        }
        var iterator = entries.fields();
        while (iterator.hasNext()) {
            var entry = iterator.next();
            var key = normalizeKey(entry.getKey());
            try {
                var profile = parseProfile(entry.getValue());
                profiles.put(key, profile);
                log.debug("Loaded profile: {} -> {}", key, profile);
            } catch (ConfigurationException | IllegalArgumentException e) {
                log.warn("Skipping search profile {}: {}", key, e.getMessage());
            }
        }
        log.info("Loaded {} search profiles", profiles.size());
    }

    private String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    }

    private boolean flag(JsonNode node, String field, boolean defaultValue) {
        var value = node.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new ConfigurationException(field + " must be true or false: " + value);
        }
        return value.booleanValue();
    }

    private double number(JsonNode node, String field, double defaultValue) {
        var value = node.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (!value.isNumber()) {
            throw new ConfigurationException(field + " must be a number: " + value);
        }
        return value.doubleValue();
    }

    private SearchProfile parseProfile(JsonNode node) {
        var defaults = SearchProfile.defaults();
        var function = node.has("function") ? SearchFunction.valueOf(
        node.get("function").asText().toUpperCase(Locale.ROOT)) : defaults.function();
        var policy = node.has("radiusPolicy") ? RadiusPolicy.valueOf(
        node.get("radiusPolicy").asText().toUpperCase(Locale.ROOT)) : defaults.radiusPolicy();
        var radius = number(node, "initialRadius", defaults.initialRadius());
        if (radius < 0.0) {
            radius = -radius;
            policy = RadiusPolicy.FIXED;
        }
        var multiplier = number(node, "multiplier", defaults.multiplier());
        var verify = flag(node, "verify", defaults.verify());
        var limit = number(node, "distanceLimit", defaults.distanceLimit());
        return new SearchProfile(function, policy, radius, multiplier, verify, limit);
    }
}
