package com.labtrace.lims.api.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Laboratory-wide presentation settings used when building certificate reports.
 * Template settings keys: {@code visibleFields}, {@code labelOverrides}, {@code columnOrder}.
 */
@Entity
@Table(name = "lab_settings")
public class LabSettings extends AbstractAuditingEntity<UUID> implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue
    @Column(name = "id", columnDefinition = "uuid")
    private UUID id;

    @Column(name = "lab_name", length = 255)
    private String labName;

    @Column(name = "lab_logo_url", length = 1024)
    private String labLogoUrl;

    @Column(name = "disclaimer_text", columnDefinition = "text")
    private String disclaimerText;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "template_settings")
    private Map<String, Object> templateSettings = new LinkedHashMap<>();

    @Override
    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getLabName() {
        return labName;
    }

    public void setLabName(String labName) {
        this.labName = labName;
    }

    public String getLabLogoUrl() {
        return labLogoUrl;
    }

    public void setLabLogoUrl(String labLogoUrl) {
        this.labLogoUrl = labLogoUrl;
    }

    public String getDisclaimerText() {
        return disclaimerText;
    }

    public void setDisclaimerText(String disclaimerText) {
        this.disclaimerText = disclaimerText;
    }

    public Map<String, Object> getTemplateSettings() {
        return templateSettings;
    }

    public void setTemplateSettings(Map<String, Object> templateSettings) {
        this.templateSettings = templateSettings;
    }
}
