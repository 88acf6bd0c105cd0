package com.ihcstruct.service.extraction;

import com.ihcstruct.TestDictionaries;
import com.ihcstruct.model.dictionary.MarkerDictionary;
import com.ihcstruct.model.extraction.MarkerMention;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkerLocatorTest {

    private final MarkerLocator locator = new MarkerLocator();
    private final MarkerDictionary dictionary = TestDictionaries.standard();

    @Test
    void findsMarkersCaseInsensitivelyInPositionOrder() {
        List<MarkerMention> mentions = locator.locate("Her2 negative, er Positive", dictionary);

        assertThat(mentions).extracting(m -> m.definition().canonical()).containsExactly("HER2", "ER");
        assertThat(mentions).extracting(MarkerMention::matchedText).containsExactly("Her2", "er");
        assertThat(mentions.get(1).start()).isEqualTo(15);
        assertThat(mentions.get(1).end()).isEqualTo(17);
    }

    @Test
    void longerAliasWinsAtTheSamePosition() {
        List<MarkerMention> mentions = locator.locate("Napsin A positive", dictionary);

        assertThat(mentions).hasSize(1);
        assertThat(mentions.get(0).definition().canonical()).isEqualTo("NAPSINA");
        assertThat(mentions.get(0).matchedText()).isEqualTo("Napsin A");
    }

    @Test
    void respectsWordBoundaries() {
        assertThat(locator.locate("Provided material, tumor cells are positive", dictionary)).isEmpty();
        assertThat(locator.locate("Napsin and TTF-1 positive", dictionary))
            .extracting(m -> m.definition().canonical())
            .containsExactly("NAPSINA", "TTF1");
    }

    @Test
    void keepsRepeatedMentionsOfTheSameMarker() {
        List<MarkerMention> mentions = locator.locate("ER positive, repeat ER positive", dictionary);

        assertThat(mentions).hasSize(2);
        assertThat(mentions).allMatch(m -> m.definition().canonical().equals("ER"));
    }

    @Test
    void markerlessClauseYieldsNoMentions() {
        assertThat(locator.locate("Adequate tissue for evaluation", dictionary)).isEmpty();
        assertThat(locator.locate("", dictionary)).isEmpty();
    }
}
