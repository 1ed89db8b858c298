package com.phillippitts.mediatoolbox.presentation.controller;

import com.phillippitts.mediatoolbox.config.properties.JobProperties;
import com.phillippitts.mediatoolbox.domain.JobRequest;
import com.phillippitts.mediatoolbox.presentation.dto.CancelView;
import com.phillippitts.mediatoolbox.presentation.dto.JobStartRequest;
import com.phillippitts.mediatoolbox.presentation.dto.JobStatusView;
import com.phillippitts.mediatoolbox.service.job.JobHandle;
import com.phillippitts.mediatoolbox.service.job.JobSupervisor;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.Executor;

/**
 * Job API: start a job and stream its progress, cancel it, query the active job.
 */
@RestController
@RequestMapping("/api/jobs")
class JobController {

    private static final Logger LOG = LogManager.getLogger(JobController.class);

    /** Emitters never time out; the job decides when the stream ends. */
    private static final long NO_TIMEOUT = 0L;

    private final JobSupervisor supervisor;
    private final JobProperties properties;
    private final Executor eventExecutor;

    JobController(JobSupervisor supervisor, JobProperties properties,
                  @Qualifier("eventExecutor") Executor eventExecutor) {
        this.supervisor = supervisor;
        this.properties = properties;
        this.eventExecutor = eventExecutor;
    }

    /**
     * Starts a job and returns its event stream: {@code progress} events, then one of
     * {@code complete}, {@code cancelled} or {@code error}.
     */
    @PostMapping
    SseEmitter start(@Valid @RequestBody JobStartRequest body) {
        JobRequest request = body.toJobRequest();
        SseEmitter emitter = new SseEmitter(NO_TIMEOUT);
        SseJobListener listener = new SseJobListener(emitter, request.tool(), eventExecutor,
                properties.eventQueueCapacity());
        JobHandle handle = supervisor.start(request, listener);
        LOG.info("Streaming job {} ({})", handle.jobId(), handle.tool().displayName());
        return emitter;
    }

    @PostMapping("/cancel")
    ResponseEntity<CancelView> cancel() {
        return ResponseEntity.ok(CancelView.from(supervisor.cancel()));
    }

    @GetMapping("/active")
    ResponseEntity<JobStatusView> active() {
        return supervisor.activeJob()
                .map(JobStatusView::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
