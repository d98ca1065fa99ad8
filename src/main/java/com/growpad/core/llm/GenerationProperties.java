package com.growpad.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the generation collaborator.
 */
@Component
@ConfigurationProperties(prefix = "growpad.generation")
public class GenerationProperties {

    /** Provider key. Generation is unavailable while this is blank. */
    private String apiKey = "";

    private String model = "gpt-4o-mini";

    private double textTemperature = 0.2;

    private double jsonTemperature = 0.1;

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public double getTextTemperature() { return textTemperature; }
    public void setTextTemperature(double textTemperature) { this.textTemperature = textTemperature; }

    public double getJsonTemperature() { return jsonTemperature; }
    public void setJsonTemperature(double jsonTemperature) { this.jsonTemperature = jsonTemperature; }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
