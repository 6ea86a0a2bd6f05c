package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.dto.risk.SignalStatus;
import com.architecture.memory.riskscope.service.validation.SignalState;
import com.architecture.memory.riskscope.service.validation.SignalValidator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Tier2SignalCalculatorTest {

    @Mock
    private SignalCalculator ownership;

    @Mock
    private SignalCalculator coupling;

    @Mock
    private SignalValidator signalValidator;

    @Test
    void computesOnDemandSignal_withFalsePositiveRate() {
        when(ownership.name()).thenReturn(SignalName.OWNERSHIP_CHURN);
        when(coupling.name()).thenReturn(SignalName.COUPLING);
        when(signalValidator.state(SignalName.OWNERSHIP_CHURN)).thenReturn(new SignalState(true, 0.01));
        when(ownership.calculate("a.go")).thenReturn(SignalResult.builder()
                .name(SignalName.OWNERSHIP_CHURN).filePath("a.go").status(SignalStatus.COMPUTED)
                .value(12.0).signalLevel(RiskLevel.HIGH).build());
        Tier2SignalCalculator tier2 = new Tier2SignalCalculator(List.of(ownership, coupling), signalValidator);

        SignalResult result = tier2.calculate(SignalName.OWNERSHIP_CHURN, "a.go");

        assertThat(result.getValue()).isEqualTo(12.0);
        assertThat(result.getFalsePositiveRate()).isEqualTo(0.01);
    }

    @Test
    void returnsDisabled_withoutComputing() {
        when(ownership.name()).thenReturn(SignalName.OWNERSHIP_CHURN);
        when(signalValidator.state(SignalName.OWNERSHIP_CHURN)).thenReturn(new SignalState(false, 0.2));
        Tier2SignalCalculator tier2 = new Tier2SignalCalculator(List.of(ownership), signalValidator);

        SignalResult result = tier2.calculate(SignalName.OWNERSHIP_CHURN, "a.go");

        assertThat(result.getStatus()).isEqualTo(SignalStatus.DISABLED);
        assertThat(tier2.available()).isEmpty();
    }

    @Test
    void rejectsBaselineSignals() {
        when(coupling.name()).thenReturn(SignalName.COUPLING);
        Tier2SignalCalculator tier2 = new Tier2SignalCalculator(List.of(coupling), signalValidator);

        assertThatThrownBy(() -> tier2.calculate(SignalName.COUPLING, "a.go"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("coupling");
    }
}
