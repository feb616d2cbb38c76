package io.github.drompincen.planloop.runtime.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Offline client returning canned JSON for each kind of request, picked from the system
 * instructions. Lets the whole pipeline run without an API key.
 *
 * Activate with: PLANLOOP_LLM_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "planloop.llm.provider", havingValue = "fake")
public class FakeModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(FakeModelClient.class);

    @Override
    public ModelResponse generate(String prompt, String systemInstructions, int maxTokens, double temperature) {
        String system = systemInstructions == null ? "" : systemInstructions.toLowerCase(Locale.ROOT);
        String text;
        if (system.contains("inbox")) {
            text = classificationResponse(prompt);
        } else if (system.contains("adjustments")) {
            text = feedbackResponse();
        } else {
            text = planResponse();
        }
        log.debug("[FAKE LLM] prompt length={}, response length={}", prompt.length(), text.length());
        int promptTokens = prompt.length() / 4;
        int completionTokens = text.length() / 4;
        return new ModelResponse(text, model(), promptTokens, completionTokens, promptTokens + completionTokens, 0);
    }

    @Override
    public String provider() {
        return "fake";
    }

    @Override
    public String model() {
        return "fake-model";
    }

    private String feedbackResponse() {
        return """
                {
                  "summary": "Feedback reviewed; no concrete task changes identified.",
                  "adjustments": [
                    {
                      "adjustment_type": "general",
                      "description": "Review the feedback with the team at the next planning session",
                      "original_value": null,
                      "new_value": null,
                      "reasoning": "Offline model cannot analyse the text"
                    }
                  ]
                }""";
    }

    private String planResponse() {
        return """
                {
                  "summary": "Baseline plan",
                  "goals": ["Deliver the first usable version"],
                  "roadmap_steps": [
                    {"step_number": 1, "title": "Scope", "description": "Agree on scope", "estimated_duration": "1 week", "dependencies": []},
                    {"step_number": 2, "title": "Build", "description": "Implement the core", "estimated_duration": "3 weeks", "dependencies": [1]}
                  ],
                  "milestones": [
                    {"title": "MVP", "target_date": "end of month 1", "deliverables": ["working build"]}
                  ],
                  "risks": ["Scope creep"],
                  "next_steps": ["Write down the scope"]
                }""";
    }

    private String classificationResponse(String prompt) {
        String marker = "Inbox item: \"";
        int start = prompt.indexOf(marker);
        String item = prompt;
        if (start >= 0) {
            int from = start + marker.length();
            int end = prompt.indexOf('"', from);
            item = end > from ? prompt.substring(from, end) : prompt.substring(from);
        }
        if (item.toLowerCase(Locale.ROOT).contains("project")) {
            return """
                    {"action": "create_project", "project_name": "New Project", "project_description": "Created from inbox", "reasoning": "Mentions a project"}""";
        }
        return """
                {"action": "no_action", "reasoning": "Looks like a note"}""";
    }
}
