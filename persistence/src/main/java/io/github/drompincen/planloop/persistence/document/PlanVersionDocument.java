package io.github.drompincen.planloop.persistence.document;

import io.github.drompincen.planloop.protocol.api.PlanContent;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "plan_versions")
@CompoundIndex(name = "project_version", def = "{'projectId': 1, 'versionNumber': -1}", unique = true)
public class PlanVersionDocument {

    @Id
    private String planVersionId;
    private String projectId;
    private int versionNumber;
    private PlanContent content;
    private String createdBy;
    private Instant createdAt;

    public PlanVersionDocument() {}

    public String getPlanVersionId() { return planVersionId; }
    public void setPlanVersionId(String planVersionId) { this.planVersionId = planVersionId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public int getVersionNumber() { return versionNumber; }
    public void setVersionNumber(int versionNumber) { this.versionNumber = versionNumber; }

    public PlanContent getContent() { return content; }
    public void setContent(PlanContent content) { this.content = content; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
