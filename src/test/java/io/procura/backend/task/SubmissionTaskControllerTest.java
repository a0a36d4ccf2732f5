package io.procura.backend.task;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.procura.backend.TestcontainersConfiguration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class SubmissionTaskControllerTest {

  @Autowired private MockMvc mockMvc;

  private JwtRequestPostProcessor officerJwt(String subject) {
    return jwt()
        .jwt(j -> j.subject(subject))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_CONTRACT_OFFICER")));
  }

  private String createSubmission() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/submissions")
                    .with(officerJwt("owner-1"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"opportunityId": "%s", "title": "Fleet telematics",
                         "portal": "sam.gov", "estimatedValue": 100000}
                        """
                            .formatted(UUID.randomUUID())))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private String taskId(String submissionId, int index) throws Exception {
    var result =
        mockMvc
            .perform(
                get("/api/submissions/" + submissionId + "/tasks").with(officerJwt("owner-1")))
            .andExpect(status().isOk())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$[" + index + "].id");
  }

  private String toggle(boolean completed) {
    return "{\"completed\": " + completed + "}";
  }

  @Test
  void newSubmissionHasDefaultChecklist() throws Exception {
    var id = createSubmission();

    mockMvc
        .perform(get("/api/submissions/" + id + "/tasks").with(officerJwt("owner-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(5))
        .andExpect(jsonPath("$[0].title").value("Complete Checklist"))
        .andExpect(jsonPath("$[0].locked").value(false))
        .andExpect(jsonPath("$[2].title").value("Legal Review"))
        .andExpect(jsonPath("$[2].linkedStep").value("legal"))
        .andExpect(jsonPath("$[4].title").value("Final Review"))
        .andExpect(jsonPath("$[4].locked").value(true));
  }

  @Test
  void ownerTogglesTaskAndTrailRecordsIt() throws Exception {
    var id = createSubmission();
    var taskId = taskId(id, 0);

    mockMvc
        .perform(
            patch("/api/submissions/" + id + "/tasks/" + taskId)
                .with(officerJwt("owner-1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(toggle(true)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.completed").value(true))
        .andExpect(jsonPath("$.completedBy").value("owner-1"))
        .andExpect(jsonPath("$.completedAt").isNotEmpty());

    mockMvc
        .perform(get("/api/submissions/" + id + "/audit-trail").with(officerJwt("owner-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(true))
        .andExpect(jsonPath("$.entries.length()").value(1))
        .andExpect(jsonPath("$.entries[0].entry.action").value("task.completed"));
  }

  @Test
  void lockedTaskIsBadRequest() throws Exception {
    var id = createSubmission();
    var legalReview = taskId(id, 2);

    mockMvc
        .perform(
            patch("/api/submissions/" + id + "/tasks/" + legalReview)
                .with(officerJwt("owner-1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(toggle(true)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Task locked"));
  }

  @Test
  void missingCompletedFlagIsBadRequest() throws Exception {
    var id = createSubmission();
    var taskId = taskId(id, 0);

    mockMvc
        .perform(
            patch("/api/submissions/" + id + "/tasks/" + taskId)
                .with(officerJwt("owner-1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void nonOwnerIsForbidden() throws Exception {
    var id = createSubmission();
    var taskId = taskId(id, 1);

    mockMvc
        .perform(
            patch("/api/submissions/" + id + "/tasks/" + taskId)
                .with(officerJwt("owner-2"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(toggle(true)))
        .andExpect(status().isForbidden());
  }

  @Test
  void unknownTaskIsNotFound() throws Exception {
    var id = createSubmission();

    mockMvc
        .perform(
            patch("/api/submissions/" + id + "/tasks/" + UUID.randomUUID())
                .with(officerJwt("owner-1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(toggle(true)))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Task not found"));
  }

  @Test
  void checklistFreezesOnRequestAndReviewTasksFollowApprovals() throws Exception {
    var id = createSubmission();
    var checklist = taskId(id, 0);

    mockMvc
        .perform(post("/api/submissions/" + id + "/request-approval").with(officerJwt("owner-1")))
        .andExpect(status().isOk());

    mockMvc
        .perform(
            patch("/api/submissions/" + id + "/tasks/" + checklist)
                .with(officerJwt("owner-1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(toggle(true)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Checklist frozen"));

    mockMvc
        .perform(
            post("/api/submissions/" + id + "/steps/legal/approve").with(officerJwt("officer-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.approvalStatus").value("IN_REVIEW"));

    mockMvc
        .perform(get("/api/submissions/" + id + "/tasks").with(officerJwt("owner-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[2].completed").value(true))
        .andExpect(jsonPath("$[2].completedBy").value("officer-1"))
        .andExpect(jsonPath("$[3].completed").value(false))
        .andExpect(jsonPath("$[4].completed").value(false));
  }

  @Test
  void tasksOfUnknownSubmissionAreNotFound() throws Exception {
    mockMvc
        .perform(
            get("/api/submissions/" + UUID.randomUUID() + "/tasks").with(officerJwt("owner-1")))
        .andExpect(status().isNotFound());
  }
}
