package com.linlay.agentengine.agent;

import com.linlay.agentengine.model.ModelSettings;

import java.util.List;

/**
 * Input of {@link AgentRepository#create} and {@link AgentRepository#update}. On update a null
 * field keeps the stored value.
 */
public record AgentDraft(
        String name,
        String description,
        String systemPrompt,
        String defaultModel,
        List<String> allowedTools,
        List<String> tags,
        ModelSettings settings,
        Integer messageWindowSize,
        Boolean structuredMemoryEnabled
) {

    public static Builder builder() {
        return new Builder();
    }

    public static Builder from(Agent agent) {
        return new Builder()
                .name(agent.name())
                .description(agent.description())
                .systemPrompt(agent.systemPrompt())
                .defaultModel(agent.defaultModel())
                .allowedTools(agent.allowedTools())
                .tags(agent.tags())
                .settings(agent.settings())
                .messageWindowSize(agent.messageWindowSize())
                .structuredMemoryEnabled(agent.structuredMemoryEnabled());
    }

    public static final class Builder {
        private String name;
        private String description;
        private String systemPrompt;
        private String defaultModel;
        private List<String> allowedTools;
        private List<String> tags;
        private ModelSettings settings;
        private Integer messageWindowSize;
        private Boolean structuredMemoryEnabled;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder defaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder allowedTools(List<String> allowedTools) {
            this.allowedTools = allowedTools;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder settings(ModelSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder messageWindowSize(Integer messageWindowSize) {
            this.messageWindowSize = messageWindowSize;
            return this;
        }

        public Builder structuredMemoryEnabled(Boolean structuredMemoryEnabled) {
            this.structuredMemoryEnabled = structuredMemoryEnabled;
            return this;
        }

        public AgentDraft build() {
            return new AgentDraft(name, description, systemPrompt, defaultModel, allowedTools, tags, settings,
                    messageWindowSize, structuredMemoryEnabled);
        }
    }
}
