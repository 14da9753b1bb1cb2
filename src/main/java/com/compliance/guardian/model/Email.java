package com.compliance.guardian.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An imported email and its current classification")
public class Email {

    @Schema(description = "Unique email identifier", example = "3f1c2a9e-6f4b-4a57-9c51-3b8f0f6f1d2e")
    private String emailId;

    @Schema(description = "Sender address", example = "trader@example.com")
    private String sender;

    @Schema(description = "Subject line", example = "Quarterly results draft")
    private String subject;

    @Schema(description = "Message body")
    private String body;

    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    @Builder.Default
    private List<String> attachments = new ArrayList<>();

    private String department;

    private String businessUnit;

    @Schema(description = "Outcome label carried by the import, not authoritative", example = "cleared")
    private String categoryHint;

    @Schema(description = "When the email was received (epoch millis)", example = "1718000000000")
    private long receivedAt;

    private long importedAt;

    private String batchId;

    @Setter(AccessLevel.NONE)
    @Schema(description = "Risk score in [0, 1], null until classified", example = "0.91")
    private Double riskScore;

    @Setter(AccessLevel.NONE)
    @Schema(description = "Predicted category, null until classified", example = "POLICY_VIOLATION")
    private Category predictedCategory;

    @Schema(description = "Whether the sender was flagged by the registry or an admin rule")
    private boolean flagged;

    @Schema(description = "Current investigation case, if any")
    private String caseId;

    @Schema(description = "FALSE_POSITIVE case that was replaced when this email was re-opened")
    private String reopenedFromCaseId;

    /**
     * Score and category always move together.
     */
    public void applyClassification(double riskScore, Category category) {
        if (category == null) {
            throw new IllegalArgumentException("category is required when setting a risk score");
        }
        this.riskScore = riskScore;
        this.predictedCategory = category;
    }

    @JsonIgnore
    public boolean isClassified() {
        return riskScore != null && predictedCategory != null;
    }

    @JsonIgnore
    public String getText() {
        String s = subject != null ? subject : "";
        String b = body != null ? body : "";
        return s + " " + b;
    }

    @JsonIgnore
    public String getSenderDomain() {
        if (sender == null) return null;
        int at = sender.lastIndexOf('@');
        return at >= 0 ? sender.substring(at + 1) : null;
    }
}
