package com.decisionengine.domain.model;

import java.util.Map;

/**
 * One sample of a sensitivity sweep.
 *
 * @param input  the swept quantity (probability, branch value or risk aversion)
 * @param label  display form of the input; for risk sweeps the risk tolerance ("Infinity" at zero aversion)
 * @param values dependent values keyed by series name, in series order
 */
public record SensitivityRow(double input, String label, Map<String, Double> values) {}
