package com.ihcstruct.config;

import com.ihcstruct.model.dictionary.MarkerDefinition;
import com.ihcstruct.model.dictionary.MarkerDictionary;
import com.ihcstruct.model.enums.MarkerRequirement;
import com.ihcstruct.model.enums.StainingPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the shared marker dictionary from configuration.
 * An invalid dictionary stops application startup.
 */
@Configuration
@EnableConfigurationProperties(IhcProperties.class)
@Slf4j
public class MarkerDictionaryConfig {

    @Bean
    public MarkerDictionary markerDictionary(IhcProperties properties) {
        List<MarkerDefinition> definitions = properties.getMarkers().stream()
            .map(MarkerDictionaryConfig::toDefinition)
            .toList();

        MarkerDictionary dictionary = MarkerDictionary.of(definitions);
        if (dictionary.isEmpty()) {
            log.warn("Marker dictionary is empty; every case will report NO_MARKERS_FOUND");
        } else {
            log.info("Loaded marker dictionary with {} markers and {} aliases",
                dictionary.size(), dictionary.aliasPatterns().size());
        }
        return dictionary;
    }

    static MarkerDefinition toDefinition(IhcProperties.MarkerEntry entry) {
        Set<StainingPattern> patterns = EnumSet.noneOf(StainingPattern.class);
        for (String pattern : entry.getAllowedPatterns()) {
            patterns.add(StainingPattern.fromValue(pattern.strip()));
        }

        Set<MarkerRequirement> requirements = EnumSet.noneOf(MarkerRequirement.class);
        for (String requirement : entry.getRequirements()) {
            requirements.add(MarkerRequirement.fromValue(requirement.strip()));
        }

        return new MarkerDefinition(
            entry.getCanonical(),
            entry.getDisplayName(),
            entry.getAliases(),
            entry.isHardPatternEnforce(),
            patterns,
            requirements
        );
    }
}
