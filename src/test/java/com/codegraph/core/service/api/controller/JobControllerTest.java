package com.codegraph.core.service.api.controller;

import com.codegraph.core.service.api.dto.EnhancementRequest;
import com.codegraph.core.service.pipeline.JobRegistry;
import com.codegraph.core.service.pipeline.JobStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class JobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JobRegistry jobRegistry;

    @TempDir
    Path repo;

    @Test
    @DisplayName("POST /jobs accepts a job that can then be polled to completion")
    void submitAndPoll() throws Exception {
        Files.writeString(repo.resolve("app.py"), "def main():\n    pass\n");
        EnhancementRequest request = EnhancementRequest.builder()
                .repoUrl(repo.toUri().toString())
                .repoId("jobs-api")
                .dryRun(true)
                .build();

        MvcResult result = mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("pending"))
                .andExpect(jsonPath("$.data.repoId").value("jobs-api"))
                .andReturn();

        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        String jobId = body.path("data").path("id").asText();

        await().atMost(30, TimeUnit.SECONDS)
                .until(() -> jobRegistry.find(jobId).map(job -> job.status() == JobStatus.COMPLETED).orElse(false));

        mockMvc.perform(get("/jobs/" + jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.progress").value(1.0))
                .andExpect(jsonPath("$.data.result.summary.files").value(1))
                .andExpect(jsonPath("$.data.result.findings.static").isArray());

        mockMvc.perform(get("/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    @DisplayName("Invalid submissions are rejected with 400")
    void rejectsInvalidRequests() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(EnhancementRequest.builder().build())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(EnhancementRequest.builder()
                                .repoUrl("ftp://example.com/repo").build())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(EnhancementRequest.builder()
                                .repoUrl("https://github.com/acme/widgets.git")
                                .languages(List.of("cobol"))
                                .build())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("Unknown jobs return 404 with the job id")
    void unknownJob() throws Exception {
        mockMvc.perform(get("/jobs/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("JOB_NOT_FOUND"))
                .andExpect(jsonPath("$.error.entityId").value("does-not-exist"));

        mockMvc.perform(post("/jobs/does-not-exist/cancel"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("JOB_NOT_FOUND"));
    }

    @Test
    @DisplayName("Cancelling a finished job leaves it unchanged")
    void cancelFinishedJob() throws Exception {
        EnhancementRequest request = EnhancementRequest.builder()
                .repoUrl(repo.resolve("missing").toUri().toString())
                .dryRun(true)
                .build();
        MvcResult result = mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andReturn();
        String jobId = objectMapper.readTree(result.getResponse().getContentAsString())
                .path("data").path("id").asText();

        await().atMost(30, TimeUnit.SECONDS)
                .until(() -> jobRegistry.find(jobId).map(job -> job.isTerminal()).orElse(false));

        mockMvc.perform(post("/jobs/" + jobId + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("failed"));
        assertThat(jobRegistry.find(jobId)).get().extracting(job -> job.status()).isEqualTo(JobStatus.FAILED);
    }
}
