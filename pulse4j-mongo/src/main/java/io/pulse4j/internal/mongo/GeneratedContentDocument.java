package io.pulse4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for generated artifacts.
 */
@Document(collection = "generated_content")
public class GeneratedContentDocument {

    @Id
    private String id;

    private String scheduledJobId;
    private String templateRef;
    private String userContext;
    private String content;
    private Map<String, Object> metadata;
    private Instant createdAt;

    public GeneratedContentDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getScheduledJobId() {
        return scheduledJobId;
    }

    public void setScheduledJobId(String scheduledJobId) {
        this.scheduledJobId = scheduledJobId;
    }

    public String getTemplateRef() {
        return templateRef;
    }

    public void setTemplateRef(String templateRef) {
        this.templateRef = templateRef;
    }

    public String getUserContext() {
        return userContext;
    }

    public void setUserContext(String userContext) {
        this.userContext = userContext;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
