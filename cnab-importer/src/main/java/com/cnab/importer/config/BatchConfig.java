package com.cnab.importer.config;

import com.cnab.importer.batch.CnabImportTasklet;
import com.cnab.importer.service.CnabImportService;
import lombok.RequiredArgsConstructor;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Spring Batch configuration for importing CNAB files that already sit on the server.
 *
 * <h3>Architecture</h3>
 * <pre>
 *  cnabImportJob ─► cnabImportStep (tasklet)
 *                        │
 *                        └── CnabImportTasklet ─► CnabImportService
 *                                                   ├── TransactionTypeCatalogLoader
 *                                                   ├── CnabBatchCollector (FlatFileItemReader + CnabLineDecoder)
 *                                                   └── TransactionBatchWriter (one REQUIRES_NEW transaction)
 * </pre>
 *
 * <p>The whole file is one unit of work, so the step is a single tasklet rather than a
 * chunk-oriented step: chunk commits would make partial batches visible.
 */
@Configuration
@RequiredArgsConstructor
public class BatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final ResourceLoader resourceLoader;

    // ─── Job ─────────────────────────────────────────────────────────────────

    @Bean
    public Job cnabImportJob(Step cnabImportStep) {
        return new JobBuilder("cnabImportJob", jobRepository)
                .start(cnabImportStep)
                .build();
    }

    @Bean
    public Step cnabImportStep(CnabImportTasklet cnabImportTasklet) {
        return new StepBuilder("cnabImportStep", jobRepository)
                .tasklet(cnabImportTasklet, transactionManager)
                .build();
    }

    /**
     * Step-scoped tasklet: job parameters name the file and the importing user; missing
     * values fall back to {@code cnab.import.*}.
     */
    @Bean
    @StepScope
    public CnabImportTasklet cnabImportTasklet(
            CnabImportService importService,
            CnabImportProperties properties,
            @Value("#{jobParameters['inputFile']}") String inputFile,
            @Value("#{jobParameters['userId']}") Long userId,
            @Value("#{jobParameters['userName']}") String userName) {
        return new CnabImportTasklet(
                importService,
                resourceLoader,
                inputFile != null ? inputFile : properties.getInputFile(),
                userId != null ? userId : properties.getJobUser().getId(),
                userName != null ? userName : properties.getJobUser().getName());
    }

    // ─── Async JobLauncher ────────────────────────────────────────────────────

    /**
     * An async {@link JobLauncher} backed by a thread-per-job executor.
     *
     * <p>Using this launcher means {@code jobLauncher.run(...)} returns immediately
     * with {@code BatchStatus.STARTING} instead of blocking until the job finishes.
     * Callers can then poll {@code GET /api/v1/batch/status/{id}} to track progress.
     */
    @Bean("asyncJobLauncher")
    @Primary
    public JobLauncher asyncJobLauncher() throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(new SimpleAsyncTaskExecutor("job-launcher-"));
        launcher.afterPropertiesSet();
        return launcher;
    }
}
