package io.agentcron.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for job definitions.
 */
@Document(collection = AgentTaskDocument.COLLECTION)
public class AgentTaskDocument {

    public static final String COLLECTION = "agent_tasks";

    @Id
    private Long id;

    private String name;
    private String info;
    private String timeSpec;
    private String prompt;
    private boolean enabled;

    private Instant createdAt;
    private Instant updatedAt;

    public AgentTaskDocument() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getInfo() {
        return info;
    }

    public void setInfo(String info) {
        this.info = info;
    }

    public String getTimeSpec() {
        return timeSpec;
    }

    public void setTimeSpec(String timeSpec) {
        this.timeSpec = timeSpec;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
