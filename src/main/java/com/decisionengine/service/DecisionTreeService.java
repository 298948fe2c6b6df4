package com.decisionengine.service;

import com.decisionengine.api.dto.request.DependencyRequest;
import com.decisionengine.api.dto.request.ProbabilisticSensitivityRequest;
import com.decisionengine.api.dto.request.RiskProfileRequest;
import com.decisionengine.api.dto.request.RiskSensitivityRequest;
import com.decisionengine.api.dto.request.RollbackRequest;
import com.decisionengine.api.dto.request.TreeDefinitionRequest;
import com.decisionengine.api.dto.request.ValueSensitivityRequest;
import com.decisionengine.api.dto.request.VariableRequest;
import com.decisionengine.api.dto.response.RiskProfileResponse;
import com.decisionengine.api.dto.response.SensitivityTableResponse;
import com.decisionengine.api.dto.response.TreeEvaluationResponse;
import com.decisionengine.config.DecisionEngineProperties;
import com.decisionengine.domain.enums.ProbabilityMode;
import com.decisionengine.domain.enums.RollbackView;
import com.decisionengine.domain.enums.UtilityFunction;
import com.decisionengine.domain.model.RiskProfileReport;
import com.decisionengine.domain.model.SensitivityTable;
import com.decisionengine.exception.BusinessException;
import com.decisionengine.exception.ErrorCode;
import com.decisionengine.mapper.DecisionTreeResponseMapper;
import com.decisionengine.mapper.TreeDefinitionMapper;
import com.decisionengine.payoff.ExpressionPayoffFunction;
import com.decisionengine.payoff.PayoffFunction;
import com.decisionengine.tree.DecisionTree;
import com.decisionengine.variable.Branch;
import com.decisionengine.variable.DependentTable;
import com.decisionengine.variable.VariableRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the decision-tree pipeline for tree definitions submitted over REST.
 *
 * <p>Every call assembles a fresh {@link VariableRegistry} from the request and builds a
 * new {@link DecisionTree}; nothing is kept between requests. Terminal payoffs are SpEL
 * expressions ({@link ExpressionPayoffFunction}) or, when absent, the sum of path values.
 */
@Service
public class DecisionTreeService {

    private static final Logger log = LoggerFactory.getLogger(DecisionTreeService.class);

    private final DecisionEngineProperties properties;

    private final TreeDefinitionMapper treeDefinitionMapper = Mappers.getMapper(TreeDefinitionMapper.class);
    private final DecisionTreeResponseMapper responseMapper = Mappers.getMapper(DecisionTreeResponseMapper.class);

    public DecisionTreeService(DecisionEngineProperties properties) {
        this.properties = properties;
    }

    public TreeEvaluationResponse rollback(RollbackRequest request) {
        DecisionTree tree = buildTree(request.getTree());
        UtilityFunction utility = utilityOrNone(request.getUtilityFunction());
        double riskTolerance = requireRiskTolerance(utility, request.getRiskTolerance());
        RollbackView view = request.getView() != null ? request.getView() : RollbackView.EV;

        tree.evaluate();
        double rootValue = tree.rollback(view, utility, riskTolerance);
        log.info("Rolled back tree '{}' ({} nodes, {} {}): {}", tree.getRootName(), tree.size(), utility, view, rootValue);

        return TreeEvaluationResponse.builder()
                .rootName(tree.getRootName())
                .view(utility.isActive() ? view : RollbackView.EV)
                .utilityFunction(utility)
                .riskTolerance(utility.isActive() ? riskTolerance : null)
                .rootValue(rootValue)
                .rootExpectedValue(tree.getRoot().getExpectedValue())
                .optimalPath(tree.getOptimalPath())
                .nodeCount(tree.size())
                .nodes(responseMapper.toNodeResponses(tree.getNodes()))
                .build();
    }

    public RiskProfileResponse riskProfile(RiskProfileRequest request) {
        DecisionTree tree = buildTree(request.getTree());
        UtilityFunction utility = utilityOrNone(request.getUtilityFunction());
        double riskTolerance = requireRiskTolerance(utility, request.getRiskTolerance());

        tree.evaluate();
        tree.rollback(RollbackView.EV, utility, riskTolerance);
        int nodeIndex = request.getNodeIndex() != null ? request.getNodeIndex() : 0;
        RiskProfileReport report = tree.riskProfile(
                nodeIndex, Boolean.TRUE.equals(request.getCumulative()), Boolean.TRUE.equals(request.getSingle()));
        log.info("Risk profile of tree '{}' at node {}: {} series",
                tree.getRootName(), nodeIndex, report.getSeries().size());
        return responseMapper.toResponse(report);
    }

    public SensitivityTableResponse probabilisticSensitivity(ProbabilisticSensitivityRequest request) {
        DecisionTree tree = buildTree(request.getTree());
        int points = pointsOrDefault(request.getPoints(), properties.getProbabilisticSensitivityPoints());
        SensitivityTable table = tree.probabilisticSensitivity(request.getVariable(), points);
        return responseMapper.toResponse(table);
    }

    public SensitivityTableResponse valueSensitivity(ValueSensitivityRequest request) {
        DecisionTree tree = buildTree(request.getTree());
        int points = pointsOrDefault(request.getPoints(), properties.getValueSensitivityPoints());
        SensitivityTable table = tree.valueSensitivity(
                request.getVariable(), request.getBranch(), request.getMinValue(), request.getMaxValue(), points);
        return responseMapper.toResponse(table);
    }

    public SensitivityTableResponse riskSensitivity(RiskSensitivityRequest request) {
        DecisionTree tree = buildTree(request.getTree());
        int points = pointsOrDefault(request.getPoints(), properties.getRiskSensitivityPoints());
        SensitivityTable table =
                tree.riskSensitivity(request.getUtilityFunction(), request.getRiskTolerance(), points);
        return responseMapper.toResponse(table);
    }

    // ==================== Registry assembly ====================

    private DecisionTree buildTree(TreeDefinitionRequest definition) {
        VariableRegistry registry = toRegistry(definition);
        String root = definition.getRoot() != null ? definition.getRoot() : registry.getInitialVariable();
        return new DecisionTree(registry, root);
    }

    private VariableRegistry toRegistry(TreeDefinitionRequest definition) {
        ProbabilityMode mode = definition.getProbabilityMode() != null
                ? definition.getProbabilityMode()
                : properties.getProbabilityMode();
        VariableRegistry registry = new VariableRegistry(mode, properties.getProbabilityTolerance());

        for (VariableRequest variable : definition.getVariables()) {
            List<Branch> branches =
                    variable.getBranches() != null ? treeDefinitionMapper.toBranches(variable.getBranches()) : List.of();
            switch (variable.getKind()) {
                case DECISION -> registry.decision(
                        variable.getName(), branches, variable.getMaximize() == null || variable.getMaximize());
                case CHANCE -> registry.chance(variable.getName(), branches);
                case TERMINAL -> registry.terminal(variable.getName(), payoffFunction(variable.getPayoff()));
            }
        }

        if (definition.getDependencies() != null) {
            for (DependencyRequest dependency : definition.getDependencies()) {
                Map<List<String>, List<Double>> table = new LinkedHashMap<>();
                dependency.getEntries().forEach(entry -> table.put(entry.getKey(), entry.getValues()));
                if (dependency.getTarget() == DependentTable.Target.PROBABILITY) {
                    registry.dependentProbabilities(dependency.getVariable(), dependency.getDependsOn(), table);
                } else {
                    registry.dependentOutcomes(dependency.getVariable(), dependency.getDependsOn(), table);
                }
            }
        }

        // forced branches last, once every variable is registered
        for (VariableRequest variable : definition.getVariables()) {
            if (variable.getForcedBranch() != null) {
                registry.forceBranch(variable.getName(), variable.getForcedBranch());
            }
        }
        return registry;
    }

    private PayoffFunction payoffFunction(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        return new ExpressionPayoffFunction(expression);
    }

    private UtilityFunction utilityOrNone(UtilityFunction utility) {
        return utility != null ? utility : UtilityFunction.NONE;
    }

    private double requireRiskTolerance(UtilityFunction utility, Double riskTolerance) {
        if (!utility.isActive()) {
            return 0.0;
        }
        if (riskTolerance == null) {
            throw new BusinessException(ErrorCode.INVALID_ARGUMENT, "riskTolerance is required for utility " + utility);
        }
        return riskTolerance;
    }

    private int pointsOrDefault(Integer requested, int configured) {
        return requested != null ? requested : configured;
    }
}
