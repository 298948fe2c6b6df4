package com.decisionengine.config;

import com.decisionengine.domain.enums.ProbabilityMode;
import com.decisionengine.sensitivity.ProbabilisticSensitivity;
import com.decisionengine.sensitivity.RiskSensitivity;
import com.decisionengine.sensitivity.ValueSensitivity;
import com.decisionengine.variable.VariableRegistry;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine defaults for trees submitted over REST, loaded from application.yml.
 *
 * <p>Properties prefix: {@code decision-engine.*}. A request may override the probability
 * mode and the number of sweep points; everything else comes from here.
 */
@Data
@Component
@ConfigurationProperties(prefix = "decision-engine")
public class DecisionEngineProperties {

    private ProbabilityMode probabilityMode = ProbabilityMode.STRICT;
    private double probabilityTolerance = VariableRegistry.DEFAULT_TOLERANCE;
    private int probabilisticSensitivityPoints = ProbabilisticSensitivity.DEFAULT_POINTS;
    private int valueSensitivityPoints = ValueSensitivity.DEFAULT_POINTS;
    private int riskSensitivityPoints = RiskSensitivity.DEFAULT_POINTS;
}
