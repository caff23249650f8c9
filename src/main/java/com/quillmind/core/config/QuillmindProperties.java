package com.quillmind.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "quillmind")
public class QuillmindProperties {

    private Quality quality = new Quality();
    private Resolution resolution = new Resolution();

    // -- Quality accessors (delegate to nested) --
    public int getQualityHistoryCapacity() { return quality.historyCapacity; }
    public double getDefaultQualityThreshold() { return quality.defaultThreshold; }
    public int getMaxImprovements() { return quality.maxImprovements; }

    // -- Resolution accessors (delegate to nested) --
    public int getResolutionHistoryCapacity() { return resolution.historyCapacity; }
    public boolean isReResolveInconsistent() { return resolution.reResolveInconsistent; }
    public double getMinimumBatchCoherence() { return resolution.minimumBatchCoherence; }

    public Quality getQuality() { return quality; }
    public void setQuality(Quality quality) { this.quality = quality; }
    public Resolution getResolution() { return resolution; }
    public void setResolution(Resolution resolution) { this.resolution = resolution; }

    public static class Quality {
        private int historyCapacity = 100;
        private double defaultThreshold = 0.8;
        private int maxImprovements = 10;

        public int getHistoryCapacity() { return historyCapacity; }
        public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }
        public double getDefaultThreshold() { return defaultThreshold; }
        public void setDefaultThreshold(double defaultThreshold) { this.defaultThreshold = defaultThreshold; }
        public int getMaxImprovements() { return maxImprovements; }
        public void setMaxImprovements(int maxImprovements) { this.maxImprovements = maxImprovements; }
    }

    public static class Resolution {
        private int historyCapacity = 1000;
        /**
         * When false, an inconsistent batch is only logged. When true, resolutions of a
         * module that received mixed decision types are re-derived with the majority type pinned.
         */
        private boolean reResolveInconsistent = false;
        private double minimumBatchCoherence = 0.7;

        public int getHistoryCapacity() { return historyCapacity; }
        public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }
        public boolean isReResolveInconsistent() { return reResolveInconsistent; }
        public void setReResolveInconsistent(boolean reResolveInconsistent) { this.reResolveInconsistent = reResolveInconsistent; }
        public double getMinimumBatchCoherence() { return minimumBatchCoherence; }
        public void setMinimumBatchCoherence(double minimumBatchCoherence) { this.minimumBatchCoherence = minimumBatchCoherence; }
    }
}
