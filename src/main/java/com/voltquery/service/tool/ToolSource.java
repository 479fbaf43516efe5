package com.voltquery.service.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Evidence a tool answer was built from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolSource {
    private String text;
    private Map<String, Object> metadata;
}
