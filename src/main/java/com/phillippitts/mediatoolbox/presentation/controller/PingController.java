package com.phillippitts.mediatoolbox.presentation.controller;

import com.phillippitts.mediatoolbox.service.job.JobSupervisor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for the launcher UI: answers while a job is running and says whether one is.
 */
@RestController
class PingController {

    private static final Logger LOG = LogManager.getLogger(PingController.class);

    private final JobSupervisor supervisor;

    PingController(JobSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        boolean busy = supervisor.activeJob().isPresent();
        LOG.debug("Ping (busy={})", busy);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("busy", busy);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }
}
