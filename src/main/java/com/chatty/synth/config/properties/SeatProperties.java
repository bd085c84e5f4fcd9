package com.chatty.synth.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Seat-to-model table.
 *
 * <p>Example application.properties:
 * <pre>
 * synth.seats.models.coding=deepseek-coder-v2
 * synth.seats.models.creative=mistral:instruct
 * synth.seats.models.smalltalk=phi3:latest
 * synth.seats.synthesis-model=phi3:latest
 * synth.seats.config-file=models.json
 * </pre>
 *
 * <p>When {@code config-file} is set, entries in that JSON file replace the property values.
 */
@ConfigurationProperties(prefix = "synth.seats")
public class SeatProperties {

    private Map<String, String> models = defaultModels();
    private String synthesisModel = "phi3:latest";
    private String configFile;

    private static Map<String, String> defaultModels() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("coding", "deepseek-coder-v2");
        m.put("creative", "mistral:instruct");
        m.put("smalltalk", "phi3:latest");
        return m;
    }

    public Map<String, String> getModels() {
        return models;
    }

    public void setModels(Map<String, String> models) {
        this.models = models;
    }

    public String getSynthesisModel() {
        return synthesisModel;
    }

    public void setSynthesisModel(String synthesisModel) {
        this.synthesisModel = synthesisModel;
    }

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }
}
