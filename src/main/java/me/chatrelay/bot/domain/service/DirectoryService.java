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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.domain.model.DirectoryEntry;
import me.chatrelay.bot.domain.model.Message;
import me.chatrelay.bot.domain.model.ToolDefinition;
import me.chatrelay.bot.port.outbound.DirectoryPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Professional directory lookups exposed to the model as tools.
 *
 * <ul>
 * <li>{@value #TOOL_FIND_PROFESSIONALS} - rows whose specialty or title
 * contains the specialty term and whose coverage area contains the city</li>
 * <li>{@value #TOOL_FIND_BY_NAME} - first row whose name contains, or is
 * contained in, the requested name</li>
 * </ul>
 * Matching is case-insensitive substring matching.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DirectoryService {

    public static final String TOOL_FIND_PROFESSIONALS = "find_professionals";
    public static final String TOOL_FIND_BY_NAME = "find_professional_by_name";

    private static final List<String> CITY_ARTICLES = List.of("los ", "las ", "la ", "el ");
    private static final String TYPE = "type";
    private static final String STRING = "string";

    private final DirectoryPort directoryPort;
    private final ObjectMapper objectMapper;

    public List<ToolDefinition> getToolDefinitions() {
        return List.of(
                ToolDefinition.builder()
                        .name(TOOL_FIND_PROFESSIONALS)
                        .description("Devuelve lista de profesionales sanitarios que cubren la ciudad y la especialidad")
                        .inputSchema(Map.of(
                                TYPE, "object",
                                "properties", Map.of(
                                        "specialty", Map.of(TYPE, STRING),
                                        "city", Map.of(TYPE, STRING)),
                                "required", List.of("specialty", "city")))
                        .build(),
                ToolDefinition.builder()
                        .name(TOOL_FIND_BY_NAME)
                        .description("Busca un profesional específico por nombre para obtener sus datos de "
                                + "contacto completos")
                        .inputSchema(Map.of(
                                TYPE, "object",
                                "properties", Map.of("name", Map.of(TYPE, STRING)),
                                "required", List.of("name")))
                        .build());
    }

    public List<DirectoryEntry> findProfessionals(String specialty, String city) {
        String specialtyTerm = lower(specialty);
        List<String> cityTerms = cityVariations(city);

        List<DirectoryEntry> matches = new ArrayList<>();
        for (DirectoryEntry entry : directoryPort.findAll()) {
            boolean professionalMatch = lower(entry.getSpecialty()).contains(specialtyTerm)
                    || lower(entry.getTitle()).contains(specialtyTerm);
            if (!professionalMatch) {
                continue;
            }
            String coverage = lower(entry.getCoverageArea());
            if (cityTerms.stream().anyMatch(coverage::contains)) {
                matches.add(entry);
            }
        }
        log.info("[Directory] {} match(es) for specialty='{}', city='{}'", matches.size(), specialty, city);
        return matches;
    }

    public Optional<DirectoryEntry> findProfessionalByName(String name) {
        String wanted = lower(name);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        for (DirectoryEntry entry : directoryPort.findAll()) {
            String professional = lower(entry.getName());
            if (professional.isEmpty()) {
                continue;
            }
            if (professional.contains(wanted) || wanted.contains(professional)) {
                log.info("[Directory] professional found for name '{}': {}", name, entry.getName());
                return Optional.of(entry);
            }
        }
        log.info("[Directory] no professional named '{}'", name);
        return Optional.empty();
    }

    /**
     * Runs a model-requested tool call and returns its JSON result. Unknown
     * tools and missing arguments produce a JSON error object instead of an
     * exception.
     */
    public String executeTool(Message.ToolCall toolCall) {
        Map<String, Object> args = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        Object result;
        switch (toolCall.getName()) {
        case TOOL_FIND_PROFESSIONALS -> {
            String specialty = stringArg(args, "specialty");
            String city = stringArg(args, "city");
            if (specialty == null || city == null) {
                result = Map.of("error", "specialty and city are required");
            } else {
                result = findProfessionals(specialty, city).stream().map(DirectoryService::toRow).toList();
            }
        }
        case TOOL_FIND_BY_NAME -> {
            String name = stringArg(args, "name");
            result = name == null
                    ? Map.of("error", "name is required")
                    : findProfessionalByName(name).map(DirectoryService::toRow).orElse(Map.of());
        }
        default -> {
            log.warn("[Directory] unknown tool requested: {}", toolCall.getName());
            result = Map.of("error", "unknown tool: " + toolCall.getName());
        }
        }

        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool result", e);
        }
    }

    /**
     * City term plus its article variants: "los lagos" also matches "lagos",
     * and "lagos" also matches "los lagos", "las lagos", "la lagos" and "el
     * lagos".
     */
    static List<String> cityVariations(String city) {
        String base = lower(city);
        List<String> variations = new ArrayList<>();
        variations.add(base);

        for (String article : CITY_ARTICLES) {
            if (base.startsWith(article)) {
                variations.add(base.substring(article.length()));
                break;
            }
        }
        if (CITY_ARTICLES.stream().noneMatch(base::contains)) {
            for (String article : CITY_ARTICLES) {
                variations.add(article + base);
            }
        }
        return variations;
    }

    private static Map<String, String> toRow(DirectoryEntry entry) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("name", nullToEmpty(entry.getName()));
        row.put("title", nullToEmpty(entry.getTitle()));
        row.put("specialty", nullToEmpty(entry.getSpecialty()));
        row.put("coverage_area", nullToEmpty(entry.getCoverageArea()));
        row.put("phone", nullToEmpty(entry.getPhone()));
        row.put("email", nullToEmpty(entry.getEmail()));
        row.put("availability", entry.getAvailabilityOrDefault());
        return row;
    }

    private static String stringArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value != null && !value.toString().isBlank() ? value.toString() : null;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
