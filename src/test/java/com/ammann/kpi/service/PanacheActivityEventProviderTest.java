/* (C)2026 */
package com.ammann.kpi.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.kpi.enumeration.ActivitySource;
import com.ammann.kpi.model.ActorEvent;
import com.ammann.kpi.model.Question;
import com.ammann.kpi.support.TestDataFactory;
import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

@QuarkusTest
class PanacheActivityEventProviderTest {

    private static final LocalDate SINCE = LocalDate.of(2021, 1, 1);

    @Inject PanacheActivityEventProvider provider;

    @Test
    @TestTransaction
    void revisionYieldsCreatorAndReviewerEvents() {
        TestDataFactory.clearSourceTables();
        TestDataFactory.revision(1L, 2L, "en-US", LocalDateTime.of(2021, 1, 10, 0, 0));
        TestDataFactory.revision(3L, null, "de", LocalDateTime.of(2021, 2, 10, 0, 0));
        TestDataFactory.revision(4L, 5L, "de", LocalDateTime.of(2020, 2, 10, 0, 0));

        assertThat(provider.activityEvents(ActivitySource.KB_REVISIONS, SINCE))
                .containsExactlyInAnyOrder(
                        ActorEvent.of(2021, 1, 1L, "en-US"),
                        ActorEvent.of(2021, 1, 2L, "en-US"),
                        ActorEvent.of(2021, 2, 3L, "de"),
                        ActorEvent.of(2021, 2, null, "de"));
    }

    @Test
    @TestTransaction
    void answersYieldOneEventPerAnswer() {
        TestDataFactory.clearSourceTables();
        Question question = TestDataFactory.question(LocalDateTime.of(2021, 1, 1, 0, 0));
        TestDataFactory.answer(question, 7L, LocalDateTime.of(2021, 1, 2, 0, 0));
        TestDataFactory.answer(question, 7L, LocalDateTime.of(2021, 1, 3, 0, 0));

        assertThat(provider.activityEvents(ActivitySource.FORUM_ANSWERS, SINCE))
                .containsExactly(ActorEvent.of(2021, 1, 7L), ActorEvent.of(2021, 1, 7L));
    }
}
