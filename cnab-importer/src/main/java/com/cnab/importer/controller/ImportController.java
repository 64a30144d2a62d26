package com.cnab.importer.controller;

import com.cnab.importer.domain.CnabUpload;
import com.cnab.importer.domain.ImportOutcome;
import com.cnab.importer.service.CnabImportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for uploading CNAB files.
 *
 * <p>The import runs on the request thread; the response carries the full
 * {@link ImportOutcome}, including per-line errors for lines that were not imported.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/transactions")
@Tag(name = "Transactions", description = "Import CNAB transaction files")
public class ImportController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_NAME_HEADER = "X-User-Name";

    private final CnabImportService importService;

    public ImportController(CnabImportService importService) {
        this.importService = importService;
    }

    // ─── POST /api/v1/transactions/upload-from-file ──────────────────────────

    @PostMapping(value = "/upload-from-file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Import a CNAB file",
            description = "Decodes every 81-character line of the uploaded file and stores the decoded "
                    + "transactions in a single transaction. Lines with an unknown type or an invalid "
                    + "date, time or amount are reported in `errors` and left out; the rest of the file "
                    + "is still imported.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Batch committed",
                            content = @Content(schema = @Schema(implementation = ImportOutcome.class))),
                    @ApiResponse(responseCode = "400", description = "File empty, nothing decodable, or storage failed",
                            content = @Content(schema = @Schema(implementation = ImportOutcome.class)))
            })
    public ResponseEntity<ImportOutcome> uploadFromFile(
            @Parameter(description = "CNAB file, one transaction per line")
            @RequestParam(value = "file", required = false) MultipartFile file,
            @Parameter(description = "Id of the user performing the import", example = "1")
            @RequestHeader(value = USER_ID_HEADER, defaultValue = "0") long userId,
            @Parameter(description = "Name recorded as the author of the imported rows", example = "admin")
            @RequestHeader(value = USER_NAME_HEADER, required = false) String userName) {

        CnabUpload upload = CnabUpload.of(file);
        log.info("Upload of '{}' received from user {}", upload.fileName(), userId);

        ImportOutcome outcome = importService.importFile(upload, userId, userName);
        return outcome.isSuccess()
                ? ResponseEntity.ok(outcome)
                : ResponseEntity.badRequest().body(outcome);
    }
}
