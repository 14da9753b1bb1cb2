package com.compliance.guardian.service;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.model.CaseStatus;
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.DashboardStats;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.InvestigationCase;
import com.compliance.guardian.model.RiskLevel;
import com.compliance.guardian.model.StatsFilter;
import com.compliance.guardian.repository.CaseRepository;
import com.compliance.guardian.repository.EmailRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only aggregate counts over emails and cases.
 */
@Service
public class DashboardService {

    private final EmailRepository emailRepository;
    private final CaseRepository caseRepository;
    private final GuardianProperties properties;

    public DashboardService(EmailRepository emailRepository,
                            CaseRepository caseRepository,
                            GuardianProperties properties) {
        this.emailRepository = emailRepository;
        this.caseRepository = caseRepository;
        this.properties = properties;
    }

    public DashboardStats getStats(StatsFilter filter) {
        StatsFilter f = filter != null ? filter : new StatsFilter();
        ZoneId zone = ZoneId.of(properties.getIngestion().getZoneId());

        List<InvestigationCase> allCases = caseRepository.findAll();
        Map<String, CaseStatus> caseStatusById = new HashMap<>();
        for (InvestigationCase c : allCases) {
            caseStatusById.put(c.getCaseId(), c.getStatus());
        }

        List<Email> emails = emailRepository.findAll().stream()
                .filter(e -> inRange(e.getReceivedAt(), f))
                .filter(e -> f.getCategory() == null || f.getCategory() == e.getPredictedCategory())
                .filter(e -> f.getStatus() == null
                        || (e.getCaseId() != null && f.getStatus() == caseStatusById.get(e.getCaseId())))
                .toList();

        List<InvestigationCase> cases = allCases.stream()
                .filter(c -> inRange(c.getCreatedAt(), f))
                .filter(c -> f.getStatus() == null || f.getStatus() == c.getStatus())
                .toList();

        Map<String, Integer> casesByStatus = new LinkedHashMap<>();
        for (CaseStatus status : CaseStatus.values()) {
            casesByStatus.put(status.name(), 0);
        }
        cases.forEach(c -> casesByStatus.merge(c.getStatus().name(), 1, Integer::sum));

        Map<String, Integer> byCategory = new LinkedHashMap<>();
        for (Category category : Category.values()) {
            byCategory.put(category.name(), 0);
        }
        Map<String, Integer> byRiskLevel = new LinkedHashMap<>();
        for (RiskLevel level : RiskLevel.values()) {
            byRiskLevel.put(level.name(), 0);
        }
        Map<String, Integer> byDay = new TreeMap<>();

        int flagged = 0;
        int classified = 0;
        for (Email email : emails) {
            if (email.isFlagged()) flagged++;
            if (email.isClassified()) {
                classified++;
                byCategory.merge(email.getPredictedCategory().name(), 1, Integer::sum);
                byRiskLevel.merge(RiskLevel.fromScore(email.getRiskScore()).name(), 1, Integer::sum);
            }
            String day = Instant.ofEpochMilli(email.getReceivedAt()).atZone(zone).toLocalDate().toString();
            byDay.merge(day, 1, Integer::sum);
        }

        return DashboardStats.builder()
                .totalEmails(emails.size())
                .flaggedEmails(flagged)
                .classifiedEmails(classified)
                .totalCases(cases.size())
                .casesByStatus(casesByStatus)
                .emailsByCategory(byCategory)
                .emailsByRiskLevel(byRiskLevel)
                .emailsByDay(new LinkedHashMap<>(byDay))
                .build();
    }

    private static boolean inRange(long timestamp, StatsFilter f) {
        if (f.getFromDate() != null && timestamp < f.getFromDate()) return false;
        if (f.getToDate() != null && timestamp > f.getToDate()) return false;
        return true;
    }
}
