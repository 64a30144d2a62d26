package com.cnab.importer.batch;

import com.cnab.importer.domain.CnabUpload;
import com.cnab.importer.domain.ImportError;
import com.cnab.importer.domain.ImportOutcome;
import com.cnab.importer.exception.CnabImportException;
import com.cnab.importer.service.CnabImportService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.util.ArrayList;
import java.util.stream.Collectors;

/**
 * Imports one server-side CNAB file as a Spring Batch step.
 *
 * <p>On success the written count, skipped-line count and any per-line error messages are
 * stored in the step {@link ExecutionContext}. A failed import fails the step with a
 * {@link CnabImportException} whose message lists the errors, so the job ends {@code FAILED}.
 *
 * <p>This class is <b>not</b> annotated with {@code @Component}: it is created as a
 * {@code @StepScope} bean in {@link com.cnab.importer.config.BatchConfig} so that each job
 * execution binds its own file and user.
 */
@Slf4j
public class CnabImportTasklet implements Tasklet {

    public static final String WRITTEN_COUNT_KEY = "writtenCount";
    public static final String SKIPPED_COUNT_KEY = "linesSkipped";
    public static final String ERRORS_KEY = "importErrors";

    private final CnabImportService importService;
    private final ResourceLoader resourceLoader;
    private final String inputFile;
    private final long userId;
    private final String userName;

    public CnabImportTasklet(CnabImportService importService,
                             ResourceLoader resourceLoader,
                             String inputFile,
                             long userId,
                             String userName) {
        this.importService = importService;
        this.resourceLoader = resourceLoader;
        this.inputFile = inputFile;
        this.userId = userId;
        this.userName = userName;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        log.info("Importing '{}' for user {} ({})", inputFile, userId, userName);

        Resource resource = resourceLoader.getResource(inputFile);
        ImportOutcome outcome = importService.importFile(CnabUpload.of(resource), userId, userName);

        if (!outcome.isSuccess()) {
            String reasons = outcome.getErrors().stream()
                    .map(ImportError::message)
                    .collect(Collectors.joining("; "));
            throw new CnabImportException("Import of '" + inputFile + "' failed: " + reasons);
        }

        contribution.incrementWriteCount(outcome.getWrittenCount());
        contribution.incrementFilterCount(outcome.getErrors().size());

        ExecutionContext context = chunkContext.getStepContext().getStepExecution().getExecutionContext();
        context.putInt(WRITTEN_COUNT_KEY, outcome.getWrittenCount());
        context.putInt(SKIPPED_COUNT_KEY, outcome.getLinesSkipped());
        context.put(ERRORS_KEY, outcome.getErrors().stream()
                .map(ImportError::message)
                .collect(Collectors.toCollection(ArrayList::new)));

        return RepeatStatus.FINISHED;
    }
}
