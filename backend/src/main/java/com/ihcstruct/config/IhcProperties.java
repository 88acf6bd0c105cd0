package com.ihcstruct.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings bound from the "ihc" prefix.
 */
@Data
@ConfigurationProperties(prefix = "ihc")
public class IhcProperties {

    /**
     * Specimen label used in the narrative when a case has no specimen id.
     */
    private String defaultSpecimen = "Specimen A";

    private Provenance provenance = new Provenance();

    /**
     * Marker dictionary entries, in lookup order.
     */
    private List<MarkerEntry> markers = new ArrayList<>();

    @Data
    public static class Provenance {
        private String extractionModel = "rules-v1";
        private String version = "ihc-mvp-1";
    }

    @Data
    public static class MarkerEntry {
        private String canonical;
        private String displayName;
        private List<String> aliases = new ArrayList<>();
        private boolean hardPatternEnforce;
        private List<String> allowedPatterns = new ArrayList<>();
        // percent_required, intensity_required
        private List<String> requirements = new ArrayList<>();
    }
}
