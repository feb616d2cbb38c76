package io.github.drompincen.planloop.runtime.daily;

import io.github.drompincen.planloop.persistence.document.TaskDocument;

public record ScoredTask(TaskDocument task, int score) {}
