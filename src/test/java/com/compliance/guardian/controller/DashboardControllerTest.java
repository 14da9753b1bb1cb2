package com.compliance.guardian.controller;

import com.compliance.guardian.model.CaseStatus;
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.DashboardStats;
import com.compliance.guardian.model.StatsFilter;
import com.compliance.guardian.service.DashboardService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DashboardController.class)
class DashboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DashboardService dashboardService;

    @Test
    void getStats_parsesFilters() throws Exception {
        when(dashboardService.getStats(any(StatsFilter.class))).thenReturn(DashboardStats.builder()
                .totalEmails(12)
                .totalCases(3)
                .casesByStatus(Map.of("OPEN", 3))
                .build());

        mockMvc.perform(get("/api/v1/dashboard/stats")
                        .param("fromDate", "1718000000000")
                        .param("status", "open")
                        .param("category", "policy violation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEmails").value(12))
                .andExpect(jsonPath("$.casesByStatus.OPEN").value(3));

        ArgumentCaptor<StatsFilter> filter = ArgumentCaptor.forClass(StatsFilter.class);
        verify(dashboardService).getStats(filter.capture());
        assertThat(filter.getValue().getFromDate()).isEqualTo(1718000000000L);
        assertThat(filter.getValue().getToDate()).isNull();
        assertThat(filter.getValue().getStatus()).isEqualTo(CaseStatus.OPEN);
        assertThat(filter.getValue().getCategory()).isEqualTo(Category.POLICY_VIOLATION);
    }

    @Test
    void getStats_unknownCategory_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/dashboard/stats").param("category", "spam"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(dashboardService);
    }
}
