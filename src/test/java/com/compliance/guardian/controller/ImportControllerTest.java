package com.compliance.guardian.controller;

import com.compliance.guardian.exception.BatchRejectedException;
import com.compliance.guardian.model.BatchResult;
import com.compliance.guardian.model.SkipReason;
import com.compliance.guardian.service.EmailPipelineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ImportController.class)
class ImportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EmailPipelineService pipelineService;

    @Test
    void importBatch_success_returnsCounts() throws Exception {
        when(pipelineService.processBatch(anyList(), eq("analyst1"))).thenReturn(BatchResult.builder()
                .batchId("B1")
                .totalRows(3)
                .imported(2)
                .classified(2)
                .casesCreated(1)
                .skipped(1)
                .skipReasons(List.of(new SkipReason(2, "sender is empty")))
                .build());

        mockMvc.perform(post("/api/v1/imports")
                        .param("actor", "analyst1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"sender\":\"a@example.com\",\"subject\":\"Hi\",\"body\":\"x\"}," +
                                "{\"sender\":\"\",\"subject\":\"Hi\",\"body\":\"y\"}," +
                                "{\"sender\":\"c@example.com\",\"subject\":\"Hi\",\"body\":\"z\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported").value(2))
                .andExpect(jsonPath("$.skipped").value(1))
                .andExpect(jsonPath("$.skipReasons[0].rowNumber").value(2))
                .andExpect(jsonPath("$.casesCreated").value(1));
    }

    @Test
    void importBatch_missingColumns_returnsBadRequest() throws Exception {
        when(pipelineService.processBatch(anyList(), any()))
                .thenThrow(new BatchRejectedException(List.of("sender", "body|content")));

        mockMvc.perform(post("/api/v1/imports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"subject\":\"Hi\"}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("BATCH_REJECTED"))
                .andExpect(jsonPath("$.missingColumns[0]").value("sender"))
                .andExpect(jsonPath("$.missingColumns[1]").value("body|content"));
    }
}
