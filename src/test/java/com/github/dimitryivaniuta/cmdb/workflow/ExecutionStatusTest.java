package com.github.dimitryivaniuta.cmdb.workflow;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionStatusTest {

    @ParameterizedTest
    @CsvSource({
            "succeeded, SUCCESS",
            "failed, FAILURE",
            "crashed, FAILURE",
            "new, RUNNING",
            "running, RUNNING",
            "waiting, RUNNING",
            "canceled, CANCELLED",
            "SUCCEEDED, SUCCESS",
            "exploded, FAILURE"
    })
    void foldsEngineStatuses(String remote, ExecutionStatus expected) {
        assertThat(ExecutionStatus.fromRemote(remote)).isEqualTo(expected);
    }

    @Test
    void missingStatusCountsAsFailure() {
        assertThat(ExecutionStatus.fromRemote(null)).isEqualTo(ExecutionStatus.FAILURE);
    }

    @Test
    void parsesStoredValues() {
        assertThat(ExecutionStatus.fromValue("cancelled")).isEqualTo(ExecutionStatus.CANCELLED);
        assertThatThrownBy(() -> ExecutionStatus.fromValue("canceled"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
