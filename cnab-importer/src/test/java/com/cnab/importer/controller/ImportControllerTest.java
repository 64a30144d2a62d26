package com.cnab.importer.controller;

import com.cnab.importer.domain.CnabUpload;
import com.cnab.importer.domain.ImportError;
import com.cnab.importer.domain.ImportOutcome;
import com.cnab.importer.domain.ImportState;
import com.cnab.importer.service.CnabImportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ImportControllerTest {

    @Mock private CnabImportService importService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ImportController(importService)).build();
    }

    @Test
    @DisplayName("200 with the outcome when the batch is committed")
    void upload_committed() throws Exception {
        when(importService.importFile(any(), eq(5L), eq("admin"))).thenReturn(ImportOutcome.builder()
                .fileName("CNAB.txt")
                .state(ImportState.COMMITTED)
                .success(true)
                .writtenCount(21)
                .decodedCount(21)
                .linesRead(21)
                .build());

        mockMvc.perform(multipart("/api/v1/transactions/upload-from-file")
                        .file(new MockMultipartFile("file", "CNAB.txt", "text/plain", "x".getBytes()))
                        .header("X-User-Id", "5")
                        .header("X-User-Name", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.state").value("COMMITTED"))
                .andExpect(jsonPath("$.writtenCount").value(21));

        ArgumentCaptor<CnabUpload> upload = ArgumentCaptor.forClass(CnabUpload.class);
        verify(importService).importFile(upload.capture(), eq(5L), eq("admin"));
        assertThat(upload.getValue().fileName()).isEqualTo("CNAB.txt");
        assertThat(upload.getValue().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("400 with the errors when the import is aborted")
    void upload_aborted() throws Exception {
        when(importService.importFile(any(), anyLong(), any())).thenReturn(ImportOutcome.aborted(
                "empty.txt", ImportError.of(ImportError.CONTEXT_UPLOAD, "File empty.")));

        mockMvc.perform(multipart("/api/v1/transactions/upload-from-file")
                        .file(new MockMultipartFile("file", "empty.txt", "text/plain", new byte[0]))
                        .header("X-User-Id", "5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errors[0].context").value("UploadFileWithTransactions"))
                .andExpect(jsonPath("$.errors[0].message").value("File empty."))
                .andExpect(jsonPath("$.errors[0].lineNumber").doesNotExist());
    }

    @Test
    @DisplayName("Request without a file part is passed on as an empty upload")
    void upload_withoutFilePart() throws Exception {
        when(importService.importFile(any(), anyLong(), any())).thenReturn(ImportOutcome.aborted(
                null, ImportError.of(ImportError.CONTEXT_UPLOAD, "File empty.")));

        mockMvc.perform(multipart("/api/v1/transactions/upload-from-file"))
                .andExpect(status().isBadRequest());

        ArgumentCaptor<CnabUpload> upload = ArgumentCaptor.forClass(CnabUpload.class);
        verify(importService).importFile(upload.capture(), eq(0L), isNull());
        assertThat(upload.getValue().isEmpty()).isTrue();
    }
}
