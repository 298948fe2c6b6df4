package com.decisionengine.api.controller;

import com.decisionengine.api.dto.request.ProbabilisticSensitivityRequest;
import com.decisionengine.api.dto.request.RiskProfileRequest;
import com.decisionengine.api.dto.request.RiskSensitivityRequest;
import com.decisionengine.api.dto.request.RollbackRequest;
import com.decisionengine.api.dto.request.ValueSensitivityRequest;
import com.decisionengine.api.dto.response.RiskProfileResponse;
import com.decisionengine.api.dto.response.SensitivityTableResponse;
import com.decisionengine.api.dto.response.TreeEvaluationResponse;
import com.decisionengine.service.DecisionTreeService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API over the decision-tree engine. Every request carries its own tree definition;
 * the server keeps no trees between calls.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/decision-trees/rollback} -- root value, optimal path, node table</li>
 *   <li>{@code POST /api/decision-trees/risk-profile} -- outcome distribution at a node</li>
 *   <li>{@code POST /api/decision-trees/sensitivity/probabilistic} -- probability sweep</li>
 *   <li>{@code POST /api/decision-trees/sensitivity/value} -- branch value sweep</li>
 *   <li>{@code POST /api/decision-trees/sensitivity/risk} -- risk tolerance sweep</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/decision-trees")
public class DecisionTreeController {

    private final DecisionTreeService decisionTreeService;

    public DecisionTreeController(DecisionTreeService decisionTreeService) {
        this.decisionTreeService = decisionTreeService;
    }

    @PostMapping("/rollback")
    public TreeEvaluationResponse rollback(@RequestBody @Valid RollbackRequest request) {
        return decisionTreeService.rollback(request);
    }

    @PostMapping("/risk-profile")
    public RiskProfileResponse riskProfile(@RequestBody @Valid RiskProfileRequest request) {
        return decisionTreeService.riskProfile(request);
    }

    @PostMapping("/sensitivity/probabilistic")
    public SensitivityTableResponse probabilisticSensitivity(
            @RequestBody @Valid ProbabilisticSensitivityRequest request) {
        return decisionTreeService.probabilisticSensitivity(request);
    }

    @PostMapping("/sensitivity/value")
    public SensitivityTableResponse valueSensitivity(@RequestBody @Valid ValueSensitivityRequest request) {
        return decisionTreeService.valueSensitivity(request);
    }

    @PostMapping("/sensitivity/risk")
    public SensitivityTableResponse riskSensitivity(@RequestBody @Valid RiskSensitivityRequest request) {
        return decisionTreeService.riskSensitivity(request);
    }
}
