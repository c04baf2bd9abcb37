package me.chatrelay.bot.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Defines a function/tool that the LLM can call during execution. Contains the
 * tool name, description, and JSON Schema for input parameters.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema
}
