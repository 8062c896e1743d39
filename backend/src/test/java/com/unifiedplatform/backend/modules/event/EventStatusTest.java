package com.unifiedplatform.backend.modules.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;

import com.unifiedplatform.backend.modules.event.domain.EventStatus;
import com.unifiedplatform.backend.modules.event.domain.ProgramEvent;

import org.junit.jupiter.api.Test;

class EventStatusTest {

    @Test
    void scheduledEventCanStartOrBeCancelled() {
        assertThat(EventStatus.SCHEDULED.allowedSuccessors())
                .containsExactlyInAnyOrder(EventStatus.IN_PROGRESS, EventStatus.CANCELLED);
        assertThat(EventStatus.IN_PROGRESS.allowedSuccessors())
                .containsExactlyInAnyOrder(EventStatus.COMPLETED, EventStatus.CANCELLED);
    }

    @Test
    void completedAndCancelledAreTerminal() {
        assertThat(EventStatus.COMPLETED.allowedSuccessors()).isEmpty();
        assertThat(EventStatus.CANCELLED.allowedSuccessors()).isEmpty();
        assertThat(EventStatus.SCHEDULED.canTransitionTo(EventStatus.COMPLETED)).isFalse();
    }

    @Test
    void rescheduleRequiresStartBeforeEnd() {
        ProgramEvent event = new ProgramEvent();
        OffsetDateTime start = OffsetDateTime.parse("2025-03-01T10:00:00Z");

        assertThatThrownBy(() -> event.reschedule(start, start)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> event.reschedule(start, start.minusMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);

        event.reschedule(start, start.plusHours(2));
        assertThat(event.getEndTime()).isEqualTo(start.plusHours(2));
    }

    @Test
    void entityFollowsTheStateMachine() {
        ProgramEvent event = new ProgramEvent();
        event.transitionTo(EventStatus.IN_PROGRESS);
        event.transitionTo(EventStatus.COMPLETED);

        assertThatThrownBy(() -> event.transitionTo(EventStatus.CANCELLED)).isInstanceOf(IllegalStateException.class);
        assertThat(event.getStatus()).isEqualTo(EventStatus.COMPLETED);
    }
}
