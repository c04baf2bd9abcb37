package me.chatrelay.bot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Allowlist check for inbound senders.
 *
 * <p>
 * Numbers are normalized by dropping spaces, dashes and {@code +}. The
 * allowlist is the union of {@code bot.access.allowed-users} and the first
 * column of the optional {@code bot.access.allowed-users-path} file; it is
 * cached for {@code bot.access.cache-ttl}. When the file cannot be read its
 * last successfully read entries are used, so the configured numbers always
 * stay allowed. With access control enabled and an empty list, nobody is
 * allowed.
 */
@Service
@Slf4j
public class AccessControlService {

    private final BotProperties properties;
    private final ResourceLoader resourceLoader;
    private final Clock clock;
    private final CsvMapper csvMapper = new CsvMapper();

    private Set<String> cachedAllowlist = Collections.emptySet();
    private Set<String> lastFileNumbers = Collections.emptySet();
    private Instant cacheLoadedAt;

    public AccessControlService(BotProperties properties, ResourceLoader resourceLoader, Clock clock) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return properties.getAccess().isEnabled();
    }

    /**
     * Returns whether the sender may use the bot. Always true when access
     * control is disabled.
     */
    public boolean isAllowed(String senderId) {
        if (!isEnabled()) {
            return true;
        }
        String normalized = normalize(senderId);
        boolean allowed = !normalized.isEmpty() && getAllowlist().contains(normalized);
        if (allowed) {
            log.debug("[Access] granted: {}", normalized);
        } else {
            log.warn("[Access] denied: {}", normalized);
        }
        return allowed;
    }

    synchronized Set<String> getAllowlist() {
        Instant now = clock.instant();
        if (cacheLoadedAt != null && now.isBefore(cacheLoadedAt.plus(properties.getAccess().getCacheTtl()))) {
            return cachedAllowlist;
        }

        Set<String> numbers = new HashSet<>();
        for (String user : properties.getAccess().getAllowedUsers()) {
            addNormalized(numbers, user);
        }
        try {
            lastFileNumbers = readAllowlistFile();
        } catch (IOException e) {
            log.error("[Access] failed to read allowlist file, keeping {} previous entries: {}",
                    lastFileNumbers.size(), e.getMessage());
        }
        numbers.addAll(lastFileNumbers);

        cachedAllowlist = Collections.unmodifiableSet(numbers);
        cacheLoadedAt = now;
        log.info("[Access] allowlist refreshed: {} numbers", numbers.size());
        return cachedAllowlist;
    }

    private Set<String> readAllowlistFile() throws IOException {
        String path = properties.getAccess().getAllowedUsersPath();
        if (path == null || path.isBlank()) {
            return Collections.emptySet();
        }
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new IOException("allowlist not found: " + path);
        }

        Set<String> numbers = new HashSet<>();
        try (InputStream in = resource.getInputStream();
                MappingIterator<String[]> rows = csvMapper.readerFor(String[].class)
                        .with(CsvParser.Feature.WRAP_AS_ARRAY)
                        .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                        .readValues(in)) {
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                if (row.length > 0) {
                    addNormalized(numbers, row[0]);
                }
            }
        }
        return numbers;
    }

    private static void addNormalized(Set<String> numbers, String raw) {
        String normalized = normalize(raw);
        if (!normalized.isEmpty() && normalized.chars().allMatch(Character::isDigit)) {
            numbers.add(normalized);
        }
    }

    static String normalize(String number) {
        if (number == null) {
            return "";
        }
        return number.trim().replace(" ", "").replace("-", "").replace("+", "");
    }
}
