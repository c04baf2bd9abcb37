package me.chatrelay.bot.adapter.outbound.directory;

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
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.domain.model.DirectoryEntry;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import me.chatrelay.bot.port.outbound.DirectoryPort;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

/**
 * Reads the professional directory from a CSV export of the directory sheet.
 *
 * <p>
 * The first row is the header; columns are matched by name so extra columns
 * and column order do not matter. Rows are loaded on first use and kept in
 * memory. A missing or unreadable file yields an empty directory.
 */
@Component
@Slf4j
public class CsvDirectoryAdapter implements DirectoryPort {

    private final BotProperties properties;
    private final ResourceLoader resourceLoader;
    private final CsvMapper csvMapper = new CsvMapper();

    private volatile List<DirectoryEntry> entries;

    public CsvDirectoryAdapter(BotProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @Override
    public List<DirectoryEntry> findAll() {
        List<DirectoryEntry> loaded = entries;
        if (loaded == null) {
            synchronized (this) {
                if (entries == null) {
                    entries = load();
                }
                loaded = entries;
            }
        }
        return loaded;
    }

    @Override
    public boolean isAvailable() {
        String path = properties.getDirectory().getPath();
        return path != null && !path.isBlank() && resourceLoader.getResource(path).exists();
    }

    /**
     * Drops the cached rows so the next lookup re-reads the file.
     */
    public synchronized void reload() {
        entries = null;
        log.info("[Directory] cache cleared");
    }

    private List<DirectoryEntry> load() {
        String path = properties.getDirectory().getPath();
        if (path == null || path.isBlank()) {
            log.warn("[Directory] bot.directory.path is not set, directory is empty");
            return Collections.emptyList();
        }

        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            log.warn("[Directory] file not found: {}", path);
            return Collections.emptyList();
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (InputStream in = resource.getInputStream();
                MappingIterator<DirectoryEntry> it = csvMapper.readerFor(DirectoryEntry.class)
                        .with(schema)
                        .readValues(in)) {
            List<DirectoryEntry> rows = List.copyOf(it.readAll());
            log.info("[Directory] loaded {} entries from {}", rows.size(), path);
            return rows;
        } catch (IOException e) {
            log.error("[Directory] failed to read {}: {}", path, e.getMessage());
            return Collections.emptyList();
        }
    }
}
