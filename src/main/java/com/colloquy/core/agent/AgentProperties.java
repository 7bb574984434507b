package com.colloquy.core.agent;

import com.colloquy.core.model.ExpertiseLevel;
import com.colloquy.core.model.Friendliness;
import com.colloquy.core.model.Humor;
import com.colloquy.core.model.Personality;
import com.colloquy.core.model.ResponseLength;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Agents declared under {@code colloquy.agents} in application configuration.
 */
@Component
@ConfigurationProperties(prefix = "colloquy")
public class AgentProperties {

    private List<AgentDefinition> agents = new ArrayList<>();

    public List<AgentDefinition> getAgents() {
        return agents;
    }

    public void setAgents(List<AgentDefinition> agents) {
        this.agents = agents;
    }

    public static class AgentDefinition {

        private String id;
        private String name;
        private String owner;
        private String prompt = "";
        private String characteristics = "";
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private String credentialRef;
        private Integer maxTokens;
        private Friendliness friendliness;
        private ResponseLength responseLength;
        private Personality personality;
        private Humor humor;
        private ExpertiseLevel expertiseLevel;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        /** User that owns the agent; blank means visible to everyone. */
        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public String getPrompt() {
            return prompt;
        }

        public void setPrompt(String prompt) {
            this.prompt = prompt;
        }

        public String getCharacteristics() {
            return characteristics;
        }

        public void setCharacteristics(String characteristics) {
            this.characteristics = characteristics;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getCredentialRef() {
            return credentialRef;
        }

        public void setCredentialRef(String credentialRef) {
            this.credentialRef = credentialRef;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Friendliness getFriendliness() {
            return friendliness;
        }

        public void setFriendliness(Friendliness friendliness) {
            this.friendliness = friendliness;
        }

        public ResponseLength getResponseLength() {
            return responseLength;
        }

        public void setResponseLength(ResponseLength responseLength) {
            this.responseLength = responseLength;
        }

        public Personality getPersonality() {
            return personality;
        }

        public void setPersonality(Personality personality) {
            this.personality = personality;
        }

        public Humor getHumor() {
            return humor;
        }

        public void setHumor(Humor humor) {
            this.humor = humor;
        }

        public ExpertiseLevel getExpertiseLevel() {
            return expertiseLevel;
        }

        public void setExpertiseLevel(ExpertiseLevel expertiseLevel) {
            this.expertiseLevel = expertiseLevel;
        }
    }
}
