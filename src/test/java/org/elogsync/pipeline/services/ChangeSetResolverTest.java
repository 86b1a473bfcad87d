package org.elogsync.pipeline.services;

import org.elogsync.pipeline.api.contracts.ChangeSet;
import org.elogsync.pipeline.api.source.SourceUnavailableException;
import org.elogsync.pipeline.testsupport.ScriptedRemoteSource;
import org.elogsync.pipeline.utils.ExcludePatterns;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ChangeSetResolverTest {

    private final ScriptedRemoteSource source = new ScriptedRemoteSource();
    private final ChangeSetResolver resolver = new ChangeSetResolver(source);

    @Test
    void excludedIdentifiersAreDropped() throws Exception {
        source.listing("mfxl1033223", "txi9999", "cxi0001");

        ChangeSet changeSet = resolver.resolve(Duration.ofHours(24), ExcludePatterns.of(List.of("txi*")));

        assertThat(changeSet.identifiers()).containsExactlyInAnyOrder("mfxl1033223", "cxi0001");
        assertThat(source.lastListWindow()).isEqualTo(Duration.ofHours(24));
    }

    @Test
    void duplicatesAndBlanksAreRemoved() throws Exception {
        source.listing("cxi0001", "", "cxi0001", " ", "mfxl1033223");

        ChangeSet changeSet = resolver.resolve(Duration.ofHours(1), ExcludePatterns.none());

        assertThat(changeSet.size()).isEqualTo(2);
    }

    @Test
    void everythingExcludedYieldsEmptySet() throws Exception {
        source.listing("txi0001", "txi0002");

        assertThat(resolver.resolve(Duration.ofHours(1), ExcludePatterns.of(List.of("txi*"))).isEmpty()).isTrue();
    }

    @Test
    void unavailableListingPropagates() {
        source.listingUnavailable(true);

        assertThatThrownBy(() -> resolver.resolve(Duration.ofHours(1), ExcludePatterns.none()))
            .isInstanceOf(SourceUnavailableException.class);
    }

    @Test
    void negativeWindowIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(Duration.ofHours(-1), ExcludePatterns.none()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
