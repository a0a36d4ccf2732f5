package io.procura.backend.task;

import io.procura.backend.security.Actor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SubmissionTaskController {

  private final SubmissionTaskService taskService;

  public SubmissionTaskController(SubmissionTaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping("/api/submissions/{id}/tasks")
  public ResponseEntity<List<TaskResponse>> listTasks(@PathVariable UUID id) {
    return ResponseEntity.ok(taskService.listTasks(id).stream().map(TaskResponse::from).toList());
  }

  @PatchMapping("/api/submissions/{id}/tasks/{taskId}")
  public ResponseEntity<TaskResponse> updateTask(
      @PathVariable UUID id,
      @PathVariable UUID taskId,
      @Valid @RequestBody UpdateTaskRequest request) {
    var task = taskService.updateTask(id, taskId, request.completed(), Actor.current());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  // --- DTOs ---

  public record UpdateTaskRequest(@NotNull(message = "completed is required") Boolean completed) {}

  public record TaskResponse(
      UUID id,
      String title,
      String subtitle,
      int sortOrder,
      boolean locked,
      String linkedStep,
      boolean completed,
      String completedBy,
      Instant completedAt) {

    public static TaskResponse from(SubmissionTask task) {
      return new TaskResponse(
          task.getId(),
          task.getTitle(),
          task.getSubtitle(),
          task.getSortOrder(),
          task.isLocked(),
          task.getLinkedStep(),
          task.isCompleted(),
          task.getCompletedBy(),
          task.getCompletedAt());
    }
  }
}
