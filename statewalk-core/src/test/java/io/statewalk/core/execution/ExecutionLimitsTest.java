package io.statewalk.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutionLimitsTest {

    @Test
    void shouldExposeDefaults() {
        ExecutionLimits limits = ExecutionLimits.DEFAULTS;

        assertThat(limits.maxSteps()).isEqualTo(1000);
        assertThat(limits.maxNodeInvocations()).isEqualTo(100);
        assertThat(limits.timeoutMs()).isEqualTo(300_000L);
        assertThat(limits.cycleDetectionWindow()).isEqualTo(20);
        assertThat(limits.maxAgentTurns()).isEqualTo(50);
        assertThat(limits.maxInvalidToolCalls()).isEqualTo(3);
    }

    @Nested
    class Validation {

        @Test
        void shouldRejectNonPositiveSteps() {
            assertThatThrownBy(() -> ExecutionLimits.builder().maxSteps(0).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maxSteps");
        }

        @Test
        void shouldAllowZeroWindowAndZeroInvalidCalls() {
            ExecutionLimits limits =
                    ExecutionLimits.builder().cycleDetectionWindow(0).maxInvalidToolCalls(0).build();

            assertThat(limits.cycleDetectionWindow()).isZero();
            assertThat(limits.maxInvalidToolCalls()).isZero();
        }

        @Test
        void shouldRejectNegativeWindow() {
            assertThatThrownBy(() -> ExecutionLimits.builder().cycleDetectionWindow(-1).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class FromProperties {

        @Test
        void shouldReadOverridesAndKeepOtherDefaults() {
            Properties properties = new Properties();
            properties.setProperty("statewalk.limits.maxSteps", " 25 ");
            properties.setProperty("statewalk.limits.timeoutMs", "1000");

            ExecutionLimits limits = ExecutionLimits.fromProperties(properties);

            assertThat(limits.maxSteps()).isEqualTo(25);
            assertThat(limits.timeoutMs()).isEqualTo(1000L);
            assertThat(limits.maxAgentTurns()).isEqualTo(ExecutionLimits.DEFAULTS.maxAgentTurns());
        }

        @Test
        void shouldRejectNonNumericProperty() {
            Properties properties = new Properties();
            properties.setProperty("statewalk.limits.maxAgentTurns", "many");

            assertThatThrownBy(() -> ExecutionLimits.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("statewalk.limits.maxAgentTurns");
        }

        @Test
        void shouldCopyIntoBuilder() {
            ExecutionLimits limits = ExecutionLimits.DEFAULTS.toBuilder().maxSteps(7).build();

            assertThat(limits.maxSteps()).isEqualTo(7);
            assertThat(limits.maxNodeInvocations()).isEqualTo(100);
        }
    }

    @Test
    void shouldValidateEngineConfig() {
        assertThatThrownBy(() -> EngineConfig.builder().agentPoolSize(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("agentPoolSize");
        assertThat(EngineConfig.builder().build().getLimits()).isEqualTo(ExecutionLimits.DEFAULTS);
    }

    @Test
    void shouldOnlyMoveStatusForward() {
        assertThat(PathStatus.ACTIVE.canMoveTo(PathStatus.WAITING_FOR_AGENT)).isTrue();
        assertThat(PathStatus.WAITING_FOR_AGENT.canMoveTo(PathStatus.COMPLETED)).isFalse();
        assertThat(PathStatus.COMPLETED.canMoveTo(PathStatus.ACTIVE)).isFalse();
        assertThat(PathStatus.FAILED.isTerminal()).isTrue();
    }
}
