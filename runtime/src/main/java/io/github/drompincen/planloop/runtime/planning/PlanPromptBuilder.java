package io.github.drompincen.planloop.runtime.planning;

import io.github.drompincen.planloop.persistence.document.ProjectDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.protocol.api.TaskPriority;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class PlanPromptBuilder {

    public static final String SYSTEM_PROMPT = """
            You are a project planning assistant. Produce a project plan with goals, a roadmap, \
            milestones, risks and next steps. Respond only with valid JSON.""";

    public String build(ProjectDocument project, List<TaskDocument> tasks) {
        StringBuilder sb = new StringBuilder();
        sb.append("Create a project plan and roadmap for the following project.\n\n");
        sb.append("Project: ").append(project.getName()).append("\n");
        sb.append("Description: ").append(project.getDescription() != null && !project.getDescription().isBlank()
                ? project.getDescription() : "No description").append("\n");
        sb.append("Status: ").append(project.getStatus()).append("\n\n");

        sb.append("Current tasks:\n");
        if (tasks.isEmpty()) {
            sb.append("No tasks yet\n");
        }
        for (TaskDocument task : tasks) {
            sb.append("- ").append(task.getTitle())
                    .append(" (priority: ").append(TaskPriority.fromValue(task.getPriority()).name().toLowerCase(Locale.ROOT))
                    .append(", status: ").append(task.getStatus());
            if (task.getDueDate() != null) {
                sb.append(", due: ").append(task.getDueDate());
            }
            sb.append(")\n");
        }

        sb.append("""

                Generate a comprehensive project plan with the following structure as JSON:
                {
                    "summary": "Brief summary of the project plan",
                    "goals": ["goal1", "goal2", "goal3"],
                    "roadmap_steps": [
                        {
                            "step_number": 1,
                            "title": "Step title",
                            "description": "What needs to be done",
                            "estimated_duration": "1 week",
                            "dependencies": []
                        }
                    ],
                    "milestones": [
                        {
                            "title": "Milestone name",
                            "target_date": "relative time like 'end of month 1'",
                            "deliverables": ["deliverable1", "deliverable2"]
                        }
                    ],
                    "risks": ["risk1", "risk2"],
                    "next_steps": ["action1", "action2", "action3"]
                }

                Guidelines:
                - Break down the project into 3-7 major roadmap steps
                - Identify key milestones and deliverables
                - Consider potential risks and mitigation strategies
                - Provide specific, actionable next steps
                - Base recommendations on the current task list and project status

                Respond only with valid JSON, no additional text.""");
        return sb.toString();
    }
}
