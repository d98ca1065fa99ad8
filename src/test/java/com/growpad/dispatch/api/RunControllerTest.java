package com.growpad.dispatch.api;

import com.growpad.core.engine.RunControlService;
import com.growpad.core.engine.RunOrchestrator;
import com.growpad.core.events.RunEvent;
import com.growpad.core.model.ApprovalDecision;
import com.growpad.core.model.RunRequest;
import com.growpad.core.model.RunStatus;
import com.growpad.core.model.RunSummary;
import com.growpad.core.model.StageId;
import com.growpad.core.store.RunNotFoundException;
import com.growpad.core.store.RunStore;
import com.growpad.core.store.WorkspaceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RunController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class RunControllerTest {

    private static final String RUN_ID = "run_0123456789ab";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RunOrchestrator orchestrator;

    @MockitoBean
    private RunControlService control;

    @MockitoBean
    private RunStore runStore;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    @TempDir
    Path artifactsDir;

    private static RunSummary summary(RunStatus status) {
        return new RunSummary(RUN_ID, "ws_0123456789ab", status, StageId.INTAKE, 0,
                Map.of(), Map.of(), null, null);
    }

    // ── POST /api/v1/runs ───────────────────────────────────────────

    @Nested
    @DisplayName("POST /runs")
    class Start {

        @Test
        @DisplayName("returns 202 Accepted with the run summary")
        void accepted() throws Exception {
            when(orchestrator.start(any(RunRequest.class))).thenReturn(summary(RunStatus.PENDING));

            mockMvc.perform(post("/api/v1/runs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"workspace_id": "ws_0123456789ab", "fast_mode": false, "selected_feature_index": 1}
                                    """))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.run_id").value(RUN_ID))
                    .andExpect(jsonPath("$.status").value("PENDING"));

            verify(orchestrator).start(new RunRequest("ws_0123456789ab", null, "", false, 1));
        }

        @Test
        @DisplayName("unknown workspace returns 404")
        void unknownWorkspace() throws Exception {
            when(orchestrator.start(any(RunRequest.class))).thenThrow(new WorkspaceNotFoundException("ws_x"));

            mockMvc.perform(post("/api/v1/runs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"workspace_id\": \"ws_x\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error", containsString("ws_x")));
        }

        @Test
        @DisplayName("invalid request returns 400")
        void badRequest() throws Exception {
            when(orchestrator.start(any(RunRequest.class)))
                    .thenThrow(new IllegalArgumentException("workspace_id is required"));

            mockMvc.perform(post("/api/v1/runs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error", containsString("required")));
        }
    }

    // ── GET /api/v1/runs ────────────────────────────────────────────

    @Test
    @DisplayName("GET /runs lists runs filtered by workspace")
    void listRuns() throws Exception {
        when(orchestrator.list("ws_0123456789ab", 5)).thenReturn(List.of(summary(RunStatus.COMPLETED)));

        mockMvc.perform(get("/api/v1/runs").param("workspace_id", "ws_0123456789ab").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runs", hasSize(1)))
                .andExpect(jsonPath("$.runs[0].status").value("COMPLETED"));
    }

    // ── GET /api/v1/runs/{id} ───────────────────────────────────────

    @Test
    @DisplayName("GET /runs/{id} returns the summary")
    void getRun() throws Exception {
        when(orchestrator.status(RUN_ID)).thenReturn(summary(RunStatus.RUNNING));

        mockMvc.perform(get("/api/v1/runs/" + RUN_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_stage").value("INTAKE"))
                .andExpect(jsonPath("$.retry_count").value(0));
    }

    @Test
    @DisplayName("GET /runs/{id} returns 404 for an unknown run")
    void getRunNotFound() throws Exception {
        when(orchestrator.status("run_missing")).thenThrow(new RunNotFoundException("run_missing"));

        mockMvc.perform(get("/api/v1/runs/run_missing"))
                .andExpect(status().isNotFound());
    }

    // ── events and artifacts ────────────────────────────────────────

    @Nested
    @DisplayName("Events and artifacts")
    class EventsAndArtifacts {

        @Test
        @DisplayName("GET /runs/{id}/events returns 404 for an unknown run")
        void sseNotFound() throws Exception {
            mockMvc.perform(get("/api/v1/runs/run_missing/events"))
                    .andExpect(status().isNotFound());
            verifyNoInteractions(sseStreamingService);
        }

        @Test
        @DisplayName("GET /runs/{id}/events opens an emitter for a known run")
        void sseEmitter() throws Exception {
            when(runStore.exists(RUN_ID)).thenReturn(true);
            when(sseStreamingService.createEmitter(RUN_ID)).thenReturn(new SseEmitter(0L));

            mockMvc.perform(get("/api/v1/runs/" + RUN_ID + "/events"))
                    .andExpect(status().isOk());
        }

        @Test
        @DisplayName("GET /runs/{id}/log returns the persisted events")
        void eventLog() throws Exception {
            when(runStore.readEvents(RUN_ID)).thenReturn(List.of(RunEvent.stageStart(StageId.INTAKE)));

            mockMvc.perform(get("/api/v1/runs/" + RUN_ID + "/log"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.events", hasSize(1)))
                    .andExpect(jsonPath("$.events[0].action").value("stage_start"))
                    .andExpect(jsonPath("$.events[0].stage").value("INTAKE"));
        }

        @Test
        @DisplayName("GET /runs/{id}/artifacts lists visible files sorted")
        void listArtifacts() throws Exception {
            Files.writeString(artifactsDir.resolve("tickets.json"), "{}");
            Files.writeString(artifactsDir.resolve("PRD.md"), "# PRD");
            Files.writeString(artifactsDir.resolve(".PRD.md.tmp"), "partial");
            when(runStore.exists(RUN_ID)).thenReturn(true);
            when(runStore.artifactsDir(RUN_ID)).thenReturn(artifactsDir);

            mockMvc.perform(get("/api/v1/runs/" + RUN_ID + "/artifacts"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.artifacts", contains("PRD.md", "tickets.json")));
        }

        @Test
        @DisplayName("GET /runs/{id}/artifacts/{name} downloads the file")
        void downloadArtifact() throws Exception {
            Files.writeString(artifactsDir.resolve("PRD.md"), "# PRD\n");
            when(runStore.exists(RUN_ID)).thenReturn(true);
            when(runStore.artifactsDir(RUN_ID)).thenReturn(artifactsDir);

            mockMvc.perform(get("/api/v1/runs/" + RUN_ID + "/artifacts/PRD.md"))
                    .andExpect(status().isOk())
                    .andExpect(content().string("# PRD\n"));
        }

        @Test
        @DisplayName("GET /runs/{id}/artifacts/{name} returns 404 for a missing file")
        void missingArtifact() throws Exception {
            when(runStore.exists(RUN_ID)).thenReturn(true);
            when(runStore.artifactsDir(RUN_ID)).thenReturn(artifactsDir);

            mockMvc.perform(get("/api/v1/runs/" + RUN_ID + "/artifacts/diff.patch"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error", containsString("diff.patch")));
        }
    }

    // ── run control ─────────────────────────────────────────────────

    @Nested
    @DisplayName("Run control")
    class Control {

        @Test
        @DisplayName("POST /runs/{id}/select-feature records the selection")
        void selectFeature() throws Exception {
            when(control.selectFeature(RUN_ID, 2)).thenReturn(summary(RunStatus.RUNNING));

            mockMvc.perform(post("/api/v1/runs/" + RUN_ID + "/select-feature")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"selected_feature_index\": 2}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.run_id").value(RUN_ID));
        }

        @Test
        @DisplayName("POST /runs/{id}/select-feature without an index returns 400")
        void selectFeatureMissingIndex() throws Exception {
            mockMvc.perform(post("/api/v1/runs/" + RUN_ID + "/select-feature")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest());
            verifyNoInteractions(control);
        }

        @Test
        @DisplayName("POST /runs/{id}/select-feature on a finished run returns 409")
        void selectFeatureConflict() throws Exception {
            when(control.selectFeature(RUN_ID, 0)).thenThrow(new IllegalStateException("Run is already COMPLETED"));

            mockMvc.perform(post("/api/v1/runs/" + RUN_ID + "/select-feature")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"selected_feature_index\": 0}"))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("POST /runs/{id}/approvals records the decision")
        void approve() throws Exception {
            when(control.recordApproval(RUN_ID, "alice", ApprovalDecision.APPROVED))
                    .thenReturn(summary(RunStatus.AWAITING_APPROVAL));

            mockMvc.perform(post("/api/v1/runs/" + RUN_ID + "/approvals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"approver\": \"alice\", \"decision\": \"APPROVED\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("AWAITING_APPROVAL"));
            verify(control).recordApproval(eq(RUN_ID), eq("alice"), eq(ApprovalDecision.APPROVED));
        }

        @Test
        @DisplayName("POST /runs/{id}/approvals with an unknown decision returns 400")
        void approveBadDecision() throws Exception {
            mockMvc.perform(post("/api/v1/runs/" + RUN_ID + "/approvals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"approver\": \"alice\", \"decision\": \"MAYBE\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error", containsString("MAYBE")));
        }

        @Test
        @DisplayName("POST /runs/{id}/cancel returns the cancelled summary")
        void cancel() throws Exception {
            when(control.cancel(RUN_ID)).thenReturn(summary(RunStatus.CANCELLED));

            mockMvc.perform(post("/api/v1/runs/" + RUN_ID + "/cancel"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("CANCELLED"));
        }

        @Test
        @DisplayName("POST /runs/{id}/cancel returns 404 for an unknown run")
        void cancelNotFound() throws Exception {
            when(control.cancel("run_missing")).thenThrow(new RunNotFoundException("run_missing"));

            mockMvc.perform(post("/api/v1/runs/run_missing/cancel"))
                    .andExpect(status().isNotFound());
        }
    }
}
