package com.ihcstruct.service;

import com.ihcstruct.dto.response.CaseOutput.RenderedSection;
import com.ihcstruct.dto.response.TableRowDto;
import com.ihcstruct.model.state.MarkerState;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Renders merged markers as a narrative block and table rows.
 *
 * Narrative line per marker with a result:
 *   "HER2: Positive, membranous, strong in 90% of cells."
 * Table row for every marker, result "" when missing.
 */
@Service
public class NarrativeRenderer {

    public RenderedSection render(Collection<MarkerState> markers, String specimenId) {
        List<TableRowDto> table = new ArrayList<>();
        List<String> lines = new ArrayList<>();

        for (MarkerState state : markers) {
            table.add(new TableRowDto(
                state.getMarkerName(),
                state.getResult() != null ? state.getResult().getValue() : "",
                state.getPattern(),
                state.getIntensity(),
                state.getPercentPositive(),
                state.getExtent(),
                state.getComment()
            ));
            if (state.getResult() != null) {
                lines.add(renderLine(state));
            }
        }

        String narrative = markers.isEmpty()
            ? null
            : "Immunohistochemistry (" + specimenId + "):\n" + String.join("\n", lines);

        return new RenderedSection(narrative, table);
    }

    String renderLine(MarkerState state) {
        List<String> pieces = new ArrayList<>();
        pieces.add(state.getResult().getValue());
        if (state.getPattern() != null) {
            pieces.add(state.getPattern().getValue());
        }
        if (state.getIntensity() != null) {
            pieces.add(state.getIntensity().getValue());
        }
        StringBuilder line = new StringBuilder()
            .append(state.getMarkerName()).append(": ")
            .append(String.join(", ", pieces));
        if (state.getPercentPositive() != null) {
            // Truncated, not rounded
            line.append(" in ").append(state.getPercentPositive().intValue()).append("% of cells");
        }
        return line.append('.').toString();
    }
}
