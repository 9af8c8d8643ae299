package org.example.stylelock.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "locked_styles",
        uniqueConstraints = @UniqueConstraint(columnNames = {"projectId", "version"}))
public class LockedStyleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 120)
    private String projectId;

    @Column(nullable = false)
    private int version;

    @Column(nullable = false, length = 200)
    private String modelId;

    @Column(nullable = false)
    private int steps;

    @Column(nullable = false)
    private double cfgScale;

    @Column(nullable = false)
    private long seedBase;

    @Column(nullable = false)
    private int width;

    @Column(nullable = false)
    private int height;

    @Column(nullable = false, length = 1000)
    private String promptSuffix;

    // newline separated artifact references
    @Column(length = 4000)
    private String validationSamples;

    private Double consistencyScore;

    @Column(nullable = false)
    private boolean approved;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private LocalDateTime lockedAt;

    private LocalDateTime approvedAt;

    private LocalDateTime supersededAt;

    public LockedStyleEntity() {}

    public LockedStyleEntity(String projectId, int version) {
        this.projectId = projectId;
        this.version = version;
        this.active = true;
        this.approved = false;
        this.lockedAt = LocalDateTime.now();
    }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public String getModelId() { return modelId; }
    public void setModelId(String modelId) { this.modelId = modelId; }

    public int getSteps() { return steps; }
    public void setSteps(int steps) { this.steps = steps; }

    public double getCfgScale() { return cfgScale; }
    public void setCfgScale(double cfgScale) { this.cfgScale = cfgScale; }

    public long getSeedBase() { return seedBase; }
    public void setSeedBase(long seedBase) { this.seedBase = seedBase; }

    public int getWidth() { return width; }
    public void setWidth(int width) { this.width = width; }

    public int getHeight() { return height; }
    public void setHeight(int height) { this.height = height; }

    public String getPromptSuffix() { return promptSuffix; }
    public void setPromptSuffix(String promptSuffix) { this.promptSuffix = promptSuffix; }

    public String getValidationSamples() { return validationSamples; }
    public void setValidationSamples(String validationSamples) { this.validationSamples = validationSamples; }

    public Double getConsistencyScore() { return consistencyScore; }
    public void setConsistencyScore(Double consistencyScore) { this.consistencyScore = consistencyScore; }

    public boolean isApproved() { return approved; }
    public void setApproved(boolean approved) { this.approved = approved; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public LocalDateTime getLockedAt() { return lockedAt; }
    public void setLockedAt(LocalDateTime lockedAt) { this.lockedAt = lockedAt; }

    public LocalDateTime getApprovedAt() { return approvedAt; }
    public void setApprovedAt(LocalDateTime approvedAt) { this.approvedAt = approvedAt; }

    public LocalDateTime getSupersededAt() { return supersededAt; }
    public void setSupersededAt(LocalDateTime supersededAt) { this.supersededAt = supersededAt; }
}
