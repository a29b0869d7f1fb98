package com.psl.orchestrator.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "orchestrator.resilience")
public class BackendResilienceProperties {
    private boolean enabled = true;
    private int vectorFailureThreshold = 3;
    private long vectorOpenMs = 30000;
    private int graphFailureThreshold = 3;
    private long graphOpenMs = 30000;
    private int metadataFailureThreshold = 5;
    private long metadataOpenMs = 15000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getVectorFailureThreshold() {
        return vectorFailureThreshold;
    }

    public void setVectorFailureThreshold(int vectorFailureThreshold) {
        this.vectorFailureThreshold = vectorFailureThreshold;
    }

    public long getVectorOpenMs() {
        return vectorOpenMs;
    }

    public void setVectorOpenMs(long vectorOpenMs) {
        this.vectorOpenMs = vectorOpenMs;
    }

    public int getGraphFailureThreshold() {
        return graphFailureThreshold;
    }

    public void setGraphFailureThreshold(int graphFailureThreshold) {
        this.graphFailureThreshold = graphFailureThreshold;
    }

    public long getGraphOpenMs() {
        return graphOpenMs;
    }

    public void setGraphOpenMs(long graphOpenMs) {
        this.graphOpenMs = graphOpenMs;
    }

    public int getMetadataFailureThreshold() {
        return metadataFailureThreshold;
    }

    public void setMetadataFailureThreshold(int metadataFailureThreshold) {
        this.metadataFailureThreshold = metadataFailureThreshold;
    }

    public long getMetadataOpenMs() {
        return metadataOpenMs;
    }

    public void setMetadataOpenMs(long metadataOpenMs) {
        this.metadataOpenMs = metadataOpenMs;
    }
}
