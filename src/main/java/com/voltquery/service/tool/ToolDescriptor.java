package com.voltquery.service.tool;

import com.voltquery.service.routing.ClassificationRule;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A registered tool: its name, its description for the decomposition prompt,
 * the classification rules that can select it, and its handler.
 */
@Value
@Builder
public class ToolDescriptor {
    String name;
    String description;
    List<ClassificationRule> rules;
    ToolHandler handler;
}
