package com.phillippitts.mediatoolbox.presentation.controller;

import com.phillippitts.mediatoolbox.config.properties.JobProperties;
import com.phillippitts.mediatoolbox.domain.JobRequest;
import com.phillippitts.mediatoolbox.domain.TerminalOutcome;
import com.phillippitts.mediatoolbox.domain.ToolKind;
import com.phillippitts.mediatoolbox.service.job.CancelAcknowledgement;
import com.phillippitts.mediatoolbox.service.job.JobHandle;
import com.phillippitts.mediatoolbox.service.job.JobListener;
import com.phillippitts.mediatoolbox.service.job.JobSnapshot;
import com.phillippitts.mediatoolbox.service.job.JobSupervisor;
import com.phillippitts.mediatoolbox.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class JobControllerTest {

    private JobSupervisor supervisor;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        supervisor = mock(JobSupervisor.class);
        JobController controller = new JobController(supervisor, JobProperties.defaults(), new SyncExecutor());
        mvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void startOpensEventStreamAndHandsRequestToSupervisor() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(supervisor.start(any(JobRequest.class), any(JobListener.class)))
                .thenReturn(new JobHandle(jobId, ToolKind.DOWNLOADER, new CompletableFuture<TerminalOutcome>()));

        mvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool\":\"DOWNLOADER\",\"arguments\":[\"-o\",\"%(title)s.%(ext)s\",\"URL\"],"
                                + "\"outputFolder\":\"/tmp/media\",\"fileNameHint\":\"clip\"}"))
                .andExpect(request().asyncStarted());

        ArgumentCaptor<JobRequest> captor = ArgumentCaptor.forClass(JobRequest.class);
        verify(supervisor).start(captor.capture(), any(JobListener.class));
        JobRequest sent = captor.getValue();
        assertThat(sent.tool()).isEqualTo(ToolKind.DOWNLOADER);
        assertThat(sent.arguments()).containsExactly("-o", "%(title)s.%(ext)s", "URL");
        assertThat(sent.outputFolder()).isEqualTo(Path.of("/tmp/media"));
        assertThat(sent.fileNameHint()).isEqualTo("clip");
    }

    @Test
    void startRejectsEmptyArgumentVector() throws Exception {
        mvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool\":\"TRANSCODER\",\"arguments\":[]}"))
                .andExpect(status().isBadRequest());

        verify(supervisor, never()).start(any(), any());
    }

    @Test
    void startRejectsMissingTool() throws Exception {
        mvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"arguments\":[\"-i\",\"in.mp4\",\"out.mkv\"]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cancelWhenIdleReportsInactive() throws Exception {
        when(supervisor.cancel()).thenReturn(CancelAcknowledgement.idle());

        mvc.perform(post("/api/jobs/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false))
                .andExpect(jsonPath("$.terminateSent").value(false))
                .andExpect(jsonPath("$.jobId").doesNotExist());
    }

    @Test
    void cancelReportsTerminatedJob() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(supervisor.cancel()).thenReturn(new CancelAcknowledgement(true, jobId, true));

        mvc.perform(post("/api/jobs/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.jobId").value(jobId.toString()))
                .andExpect(jsonPath("$.terminateSent").value(true));
    }

    @Test
    void activeReturnsNoContentWhenIdle() throws Exception {
        when(supervisor.activeJob()).thenReturn(Optional.empty());

        mvc.perform(get("/api/jobs/active"))
                .andExpect(status().isNoContent());
    }

    @Test
    void activeDescribesRunningJob() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(supervisor.activeJob()).thenReturn(Optional.of(
                new JobSnapshot(jobId, ToolKind.TRANSCODER, 4242L, Path.of("/tmp/out.mkv"), false)));

        mvc.perform(get("/api/jobs/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value(jobId.toString()))
                .andExpect(jsonPath("$.tool").value("TRANSCODER"))
                .andExpect(jsonPath("$.processId").value(4242))
                .andExpect(jsonPath("$.cancelRequested").value(false));
    }
}
