package com.cnab.importer.controller;

import com.cnab.importer.batch.CnabImportTasklet;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * REST API for importing server-side CNAB files through {@code cnabImportJob}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/batch")
@Tag(name = "Batch Jobs", description = "Trigger and monitor CNAB import jobs")
public class JobController {

    private final JobLauncher asyncJobLauncher;
    private final Job cnabImportJob;
    private final JobExplorer jobExplorer;

    public JobController(@Qualifier("asyncJobLauncher") JobLauncher asyncJobLauncher,
                         Job cnabImportJob,
                         JobExplorer jobExplorer) {
        this.asyncJobLauncher = asyncJobLauncher;
        this.cnabImportJob = cnabImportJob;
        this.jobExplorer = jobExplorer;
    }

    // ─── POST /api/v1/batch/import ────────────────────────────────────────────

    @PostMapping("/import")
    @Operation(
            summary = "Start a CNAB import job",
            description = "Launches `cnabImportJob` **asynchronously** and returns its `jobExecutionId`. "
                    + "Poll `GET /api/v1/batch/status/{jobExecutionId}` to track progress. "
                    + "Parameters left blank fall back to `cnab.import.*` in application.yml.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Job accepted and started in the background",
                            content = @Content(schema = @Schema(implementation = JobStartResponse.class))),
                    @ApiResponse(responseCode = "500", description = "Failed to launch job",
                            content = @Content(schema = @Schema(implementation = Map.class)))
            })
    public ResponseEntity<?> startImport(
            @Parameter(description = "Spring resource path of the CNAB file", example = "classpath:data/CNAB.txt")
            @RequestParam(value = "inputFile", required = false) String inputFile,
            @Parameter(description = "Id of the user the import is recorded for", example = "1")
            @RequestParam(value = "userId", required = false) Long userId,
            @Parameter(description = "Name recorded as the author of the imported rows", example = "batch")
            @RequestParam(value = "userName", required = false) String userName) {

        JobParametersBuilder builder = new JobParametersBuilder()
                .addLong("startedAt", Instant.now().toEpochMilli());
        if (inputFile != null && !inputFile.isBlank()) {
            builder.addString("inputFile", inputFile);
        }
        if (userId != null) {
            builder.addLong("userId", userId);
        }
        if (userName != null && !userName.isBlank()) {
            builder.addString("userName", userName);
        }
        JobParameters params = builder.toJobParameters();
        log.info("Starting cnabImportJob with {}", params);

        try {
            JobExecution execution = asyncJobLauncher.run(cnabImportJob, params);
            return ResponseEntity.accepted().body(new JobStartResponse(
                    execution.getId(),
                    execution.getStatus().name(),
                    inputFile,
                    execution.getStartTime() != null ? execution.getStartTime().toString() : null));
        } catch (Exception e) {
            log.error("Failed to start cnabImportJob: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to start job: " + e.getMessage()));
        }
    }

    // ─── GET /api/v1/batch/status/{jobExecutionId} ───────────────────────────

    @GetMapping("/status/{jobExecutionId}")
    @Operation(
            summary = "Get import job status",
            description = "Returns the status of a `cnabImportJob` execution, with the written count and "
                    + "per-line errors once the import step has finished.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Job execution found",
                            content = @Content(schema = @Schema(implementation = JobStatusResponse.class))),
                    @ApiResponse(responseCode = "404", description = "Job execution not found")
            })
    public ResponseEntity<?> getStatus(
            @Parameter(name = "jobExecutionId", description = "The job execution ID returned by /import", required = true)
            @PathVariable("jobExecutionId") Long jobExecutionId) {

        JobExecution execution = jobExplorer.getJobExecution(jobExecutionId);
        if (execution == null) {
            return ResponseEntity.notFound().build();
        }

        LocalDateTime startTime = execution.getStartTime();
        LocalDateTime endTime = execution.getEndTime();
        String elapsed = null;
        if (startTime != null) {
            LocalDateTime until = endTime != null ? endTime : LocalDateTime.now();
            elapsed = Duration.between(startTime, until).toSeconds() + "s";
        }

        ExitStatus exitStatus = execution.getExitStatus();
        ImportSummary summary = execution.getStepExecutions().stream()
                .findFirst()
                .map(JobController::summarize)
                .orElse(null);

        return ResponseEntity.ok(new JobStatusResponse(
                jobExecutionId,
                execution.getJobInstance() != null ? execution.getJobInstance().getJobName() : "cnabImportJob",
                execution.getStatus().name(),
                exitStatus != null ? exitStatus.getExitCode() : null,
                exitStatus != null && !exitStatus.getExitDescription().isEmpty() ? exitStatus.getExitDescription() : null,
                startTime != null ? startTime.toString() : null,
                endTime != null ? endTime.toString() : null,
                elapsed,
                summary));
    }

    @SuppressWarnings("unchecked")
    private static ImportSummary summarize(StepExecution step) {
        ExecutionContext context = step.getExecutionContext();
        List<String> errors = context.containsKey(CnabImportTasklet.ERRORS_KEY)
                ? (List<String>) context.get(CnabImportTasklet.ERRORS_KEY)
                : List.of();
        return new ImportSummary(
                step.getStatus().name(),
                context.getInt(CnabImportTasklet.WRITTEN_COUNT_KEY, 0),
                context.getInt(CnabImportTasklet.SKIPPED_COUNT_KEY, 0),
                errors);
    }

    // ─── Response records ─────────────────────────────────────────────────────

    public record JobStartResponse(Long jobExecutionId, String status, String inputFile, String startTime) {}

    /**
     * @param exitDescription failure reason when the import was aborted
     * @param summary         counts from the import step, {@code null} before the step starts
     */
    public record JobStatusResponse(
            Long jobExecutionId,
            String jobName,
            String status,
            String exitCode,
            String exitDescription,
            String startTime,
            String endTime,
            String elapsed,
            ImportSummary summary) {}

    public record ImportSummary(String stepStatus, int writtenCount, int linesSkipped, List<String> errors) {}
}
