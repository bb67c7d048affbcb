package com.chapterbus.api;

import com.chapterbus.scheduler.RunService;
import com.chapterbus.scheduler.RunService.RunStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/runs")
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RunRequest(List<Integer> chapters, Integer parallelism, Boolean continuity) {
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public RunStatus start(@RequestBody RunRequest request) {
        return runService.start(request.chapters(), request.parallelism(),
            request.continuity() == null || request.continuity());
    }

    @GetMapping
    public List<RunStatus> list() {
        return runService.list();
    }

    @GetMapping("/{runId}")
    public RunStatus status(@PathVariable String runId) {
        return runService.status(runId)
            .orElseThrow(() -> new NotFoundException("run " + runId + " not found"));
    }

    @PostMapping("/{runId}/cancel")
    public RunStatus cancel(@PathVariable String runId) {
        return runService.cancel(runId)
            .orElseThrow(() -> new NotFoundException("run " + runId + " not found"));
    }
}
