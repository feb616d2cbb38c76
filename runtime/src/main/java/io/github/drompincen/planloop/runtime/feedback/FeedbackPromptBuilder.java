package io.github.drompincen.planloop.runtime.feedback;

import io.github.drompincen.planloop.persistence.document.FeedbackDocument;
import io.github.drompincen.planloop.persistence.document.ProjectDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.protocol.api.TaskPriority;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FeedbackPromptBuilder {

    public static final String SYSTEM_PROMPT = """
            You are an intelligent project planning assistant. Analyze user feedback and suggest \
            specific adjustments to project tasks, priorities, and plans. Return your response as a \
            valid JSON object with a summary and a list of adjustments.""";

    public String build(ProjectDocument project, List<TaskDocument> tasks, FeedbackDocument feedback) {
        StringBuilder sb = new StringBuilder();
        sb.append("Project Context:\n");
        sb.append("- Name: ").append(project.getName()).append("\n");
        sb.append("- Description: ").append(orDefault(project.getDescription(), "No description")).append("\n");
        sb.append("- Status: ").append(project.getStatus()).append("\n\n");

        sb.append("Current Tasks:\n");
        if (tasks.isEmpty()) {
            sb.append("No tasks yet\n");
        }
        for (TaskDocument task : tasks) {
            sb.append("- Task ").append(task.getTaskId()).append(": ").append(task.getTitle())
                    .append(" (Status: ").append(task.getStatus())
                    .append(", Priority: ").append(task.getPriority())
                    .append(" ").append(TaskPriority.fromValue(task.getPriority()))
                    .append(", Estimate: ").append(task.getEstimatedHours() != null
                            ? task.getEstimatedHours() + "h" : "none")
                    .append(")\n");
        }
        if (feedback.getTaskId() != null) {
            sb.append("\nThe feedback was filed against task ").append(feedback.getTaskId())
                    .append(", but suggestions for any task are welcome.\n");
        }

        sb.append("\nUser Feedback:\n").append(feedback.getFeedbackText()).append("\n\n");
        sb.append("""
                Based on this feedback, analyze and suggest specific adjustments. Return a JSON object with:
                {
                    "summary": "Brief summary of analysis",
                    "adjustments": [
                        {
                            "adjustment_type": "task_priority|task_description|task_status|new_task|remove_task|task_estimate|general",
                            "description": "What adjustment to make",
                            "original_value": "Current value (if applicable)",
                            "new_value": "Suggested new value",
                            "reasoning": "Why this adjustment makes sense",
                            "task_id": "ID of affected task (if applicable)"
                        }
                    ]
                }

                Provide actionable, specific suggestions that directly address the user's feedback.
                """);
        return sb.toString();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
