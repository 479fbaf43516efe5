package com.voltquery.service.routing;

import com.voltquery.service.tool.ToolDescriptor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt asking the LLM to split a question into tool-routed sub-questions.
 */
final class DecompositionPrompt {

    static final String SYSTEM = """
            You split energy questions into sub-questions for specialised tools.
            Reply with JSON only, in the format {"items": [{"sub_question": "...", "tool_name": "..."}]}.
            Do NOT copy tool descriptions into the reply.""";

    private static final String TEMPLATE = """
            Given a user question and tools, output relevant sub-questions in JSON format.

            RULES:
            1. Create NEW sub-questions based on the user's question
            2. Do NOT copy tool descriptions
            3. Output format: {"items": [{"sub_question": "...", "tool_name": "..."}]}
            4. Keep any location (zip, city, state, coordinates) from the question in every sub-question
            5. If the question involves residential solar financing in 2026, explicitly compare the
               0% purchase credit with the 30% lease credit for homeowners.

            TAX CREDIT CONTEXT (2026):
            - Residential purchase: 0% federal tax credit
            - Residential lease: 30% federal tax credit
            - Commercial: 30% if construction starts before July 4, 2026

            EXAMPLES:

            Q: "What are the nearest DC fast charging stations and electricity cost?"
            A: {"items": [{"sub_question": "Where are the nearest DC fast charging stations?", "tool_name": "transportation_tool"}, {"sub_question": "What is the electricity cost per kWh?", "tool_name": "utility_tool"}]}

            Q: "Compare savings: charging at 11 PM vs 4kW solar in zip 45424"
            A: {"items": [{"sub_question": "What are electricity rates including time-of-use for zip 45424?", "tool_name": "utility_tool"}, {"sub_question": "What is solar production for 4kW system in zip 45424?", "tool_name": "solar_production_tool"}]}

            Q: "Should I buy or lease solar panels for my home in zip 80202 in 2026?"
            A: {"items": [{"sub_question": "What is optimal solar/storage size and NPV for residential solar purchase in zip 80202 (0% ITC)?", "tool_name": "optimization_tool"}, {"sub_question": "What is optimal solar/storage size and NPV for residential solar lease in zip 80202 (30% ITC)?", "tool_name": "optimization_tool"}]}

            Q: "How do I lower my electricity bill?"
            A: {"items": [{"sub_question": "What are current electricity rates?", "tool_name": "utility_tool"}, {"sub_question": "What building energy efficiency measures reduce consumption?", "tool_name": "buildings_tool"}, {"sub_question": "What is solar production potential to offset electricity costs?", "tool_name": "solar_production_tool"}]}

            COST + LOCATION QUESTIONS:
            If the question asks for the cheapest or most affordable place, generate one sub-question
            for stations (transportation_tool) and one for rates (utility_tool).

            <Tools>
            {{tools}}
            </Tools>

            <User Question>
            {{question}}

            <Output>
            """;

    private DecompositionPrompt() {
    }

    static String render(List<ToolDescriptor> tools, String question) {
        String toolList = tools.stream()
                .map(tool -> "- " + tool.getName() + ": " + tool.getDescription())
                .collect(Collectors.joining("\n"));
        return TEMPLATE.replace("{{tools}}", toolList).replace("{{question}}", question);
    }
}
