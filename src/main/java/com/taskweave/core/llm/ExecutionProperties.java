package com.taskweave.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Execution profiles available to the chat-backed capability, keyed by profile name.
 */
@Component
@ConfigurationProperties(prefix = "taskweave.execution")
public class ExecutionProperties {

    private Map<String, Profile> profiles = new LinkedHashMap<>();

    public Map<String, Profile> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, Profile> profiles) {
        this.profiles = profiles;
    }

    public Optional<Profile> profile(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    public static class Profile {
        private String model = "";
        private Double temperature;

        public Profile() {}

        public Profile(String model, Double temperature) {
            this.model = model;
            this.temperature = temperature;
        }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }

        public boolean hasModel() {
            return model != null && !model.isBlank();
        }
    }
}
