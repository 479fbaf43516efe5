package com.voltquery.service.tool;

/**
 * Registered tool names, as used in decomposition output.
 */
public final class ToolNames {

    public static final String TRANSPORTATION = "transportation_tool";
    public static final String UTILITY = "utility_tool";
    public static final String SOLAR_PRODUCTION = "solar_production_tool";
    public static final String BUILDINGS = "buildings_tool";
    public static final String OPTIMIZATION = "optimization_tool";

    private ToolNames() {
    }
}
