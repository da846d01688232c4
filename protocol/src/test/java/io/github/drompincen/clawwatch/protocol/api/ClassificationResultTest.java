package io.github.drompincen.clawwatch.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClassificationResultTest {

    @Test
    void routeActionParsesKnownWireNames() {
        assertThat(RouteAction.fromWire("create_reminder")).isEqualTo(RouteAction.CREATE_REMINDER);
        assertThat(RouteAction.fromWire(" schedule_task ")).isEqualTo(RouteAction.SCHEDULE_TASK);
        assertThat(RouteAction.fromWire("COMPLEX_ACTION")).isEqualTo(RouteAction.COMPLEX_ACTION);
        assertThat(RouteAction.fromWire("ignore")).isEqualTo(RouteAction.IGNORE);
    }

    @Test
    void unrecognizedActionMapsToUnknown() {
        assertThat(RouteAction.fromWire("launch_rocket")).isEqualTo(RouteAction.UNKNOWN);
        assertThat(RouteAction.fromWire("unknown")).isEqualTo(RouteAction.UNKNOWN);
        assertThat(RouteAction.fromWire(null)).isEqualTo(RouteAction.UNKNOWN);
    }

    @Test
    void priorityDefaultsToMedium() {
        assertThat(Priority.fromWire("HIGH")).isEqualTo(Priority.HIGH);
        assertThat(Priority.fromWire("critical")).isEqualTo(Priority.MEDIUM);
        assertThat(Priority.fromWire(null)).isEqualTo(Priority.MEDIUM);
    }

    @Test
    void defaultsAreFilledIn() {
        ClassificationResult result = new ClassificationResult(RouteAction.IGNORE, null, null, null, null, null);

        assertThat(result.rawAction()).isEqualTo("ignore");
        assertThat(result.priority()).isEqualTo(Priority.MEDIUM);
        assertThat(result.reason()).isEmpty();
        assertThat(result.hasTitle()).isFalse();
        assertThat(result.hasDueDate()).isFalse();
    }

    @Test
    void blankDueDateCountsAsAbsent() {
        ClassificationResult result = new ClassificationResult(RouteAction.SCHEDULE_TASK, "schedule_task",
                Priority.LOW, "later", "Renew passport", "  ");

        assertThat(result.hasTitle()).isTrue();
        assertThat(result.hasDueDate()).isFalse();
    }
}
