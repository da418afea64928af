package com.listall.importer.engine.progress;

import com.listall.importer.api.model.ImportProgress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressReporterTest {

    private final List<ImportProgress> updates = new ArrayList<>();

    @Test
    @DisplayName("Should count lists and items towards one overall fraction")
    void shouldCountTowardsOverallProgress() {
        ProgressReporter reporter = new ProgressReporter(updates::add, 2, 2);

        reporter.itemProcessed();
        reporter.itemProcessed();
        reporter.listProcessed();

        assertThat(updates).extracting(ImportProgress::currentOperation)
                .containsExactly("Processing item 1 of 2", "Processing item 2 of 2", "Processing list 1 of 2");
        assertThat(updates.get(2).overallProgress()).isEqualTo(0.75);
        assertThat(updates.get(2).progressPercentage()).isEqualTo(75);
    }

    @Test
    @DisplayName("Should never move past the totals")
    void shouldClampCounters() {
        ProgressReporter reporter = new ProgressReporter(updates::add, 1, 1);

        reporter.itemsProcessed(5);
        reporter.listProcessed();
        reporter.listProcessed();

        assertThat(reporter.current("check").processedItems()).isEqualTo(1);
        assertThat(reporter.current("check").processedLists()).isEqualTo(1);
        assertThat(updates).allSatisfy(progress -> assertThat(progress.overallProgress()).isLessThanOrEqualTo(1.0));
    }

    @Test
    @DisplayName("Should report zero progress for an empty import")
    void shouldHandleEmptyImport() {
        ProgressReporter reporter = new ProgressReporter(updates::add, 0, 0);

        reporter.complete();

        assertThat(updates).singleElement().satisfies(progress -> {
            assertThat(progress.overallProgress()).isZero();
            assertThat(progress.currentOperation()).isEqualTo("Nothing to import");
        });
    }

    @Test
    @DisplayName("Should ignore non-positive batches and tolerate a missing listener")
    void shouldIgnoreEmptyBatches() {
        ProgressReporter reporter = new ProgressReporter(null, 1, 3);

        reporter.itemsProcessed(0);
        reporter.itemsProcessed(-2);

        assertThat(reporter.current("idle").processedItems()).isZero();
    }
}
