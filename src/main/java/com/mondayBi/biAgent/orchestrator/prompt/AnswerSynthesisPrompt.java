package com.mondayBi.biAgent.orchestrator.prompt;

import java.time.LocalDate;

/**
 * Prompts for the synthesis call: turns computed board metrics into a founder-level briefing.
 */
public class AnswerSynthesisPrompt {

    private AnswerSynthesisPrompt() {}

    public static String getSystemPrompt(String qualityNotes, LocalDate today) {
        return """
            You are a sharp business analyst giving a founder a concise briefing. You work at Skylark Drones, a drone services company.

            INSTRUCTIONS:
            1. Answer the question directly, like you're briefing a CEO.
            2. Lead with the key insight or number.
            3. Include supporting data points and percentages where relevant.
            4. If there are data quality issues, mention them briefly at the end as a caveat.
            5. Use bullet points for clarity when listing multiple data points.
            6. Keep it conversational but data-driven, no filler and no hedging.
            7. Format numbers nicely (e.g., "₹12.5L" instead of "1250000").
            8. If comparing segments, use clear comparisons.
            9. Do NOT dump raw data. Synthesize insights.
            10. Keep responses concise, ideally 3-8 sentences with key numbers.

            DATA QUALITY NOTES:
            %s

            TODAY'S DATE: %s
            """.formatted(qualityNotes, today);
    }

    /**
     * Builds the final user message carrying the question, the plan and the computed data.
     */
    public static String getUserMessage(String question, String planJson, String dataJson) {
        return """
            User Question: %s

            Query Plan: %s

            Data Retrieved: %s

            Please provide a concise, insight-driven answer based on this data.""".formatted(question, planJson, dataJson);
    }
}
