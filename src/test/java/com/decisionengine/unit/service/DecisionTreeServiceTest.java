package com.decisionengine.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.decisionengine.api.dto.request.BranchRequest;
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
import com.decisionengine.api.dto.response.TreeNodeResponse;
import com.decisionengine.config.DecisionEngineProperties;
import com.decisionengine.domain.enums.ProbabilityMode;
import com.decisionengine.domain.enums.RollbackView;
import com.decisionengine.domain.enums.UtilityFunction;
import com.decisionengine.domain.enums.VariableKind;
import com.decisionengine.exception.BusinessException;
import com.decisionengine.exception.ErrorCode;
import com.decisionengine.exception.MalformedDeclarationException;
import com.decisionengine.service.DecisionTreeService;
import com.decisionengine.variable.DependentTable;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DecisionTreeServiceTest {

    private static final String PROFIT =
            "#values['bid'] < #values['compbid'] ? #values['bid'] - #values['cost'] : 0";

    private DecisionEngineProperties properties;
    private DecisionTreeService service;

    @BeforeEach
    void setUp() {
        properties = new DecisionEngineProperties();
        service = new DecisionTreeService(properties);
    }

    private static TreeDefinitionRequest bidTree() {
        return TreeDefinitionRequest.builder()
                .variables(List.of(
                        VariableRequest.builder()
                                .name("bid")
                                .kind(VariableKind.DECISION)
                                .branches(List.of(decision("low", 500, "compbid"), decision("high", 700, "compbid")))
                                .build(),
                        VariableRequest.builder()
                                .name("compbid")
                                .kind(VariableKind.CHANCE)
                                .branches(List.of(
                                        chance("low", 0.35, 400, "cost"),
                                        chance("medium", 0.50, 600, "cost"),
                                        chance("high", 0.15, 800, "cost")))
                                .build(),
                        VariableRequest.builder()
                                .name("cost")
                                .kind(VariableKind.CHANCE)
                                .branches(List.of(
                                        chance("low", 0.25, 200, "profit"),
                                        chance("medium", 0.50, 400, "profit"),
                                        chance("high", 0.25, 600, "profit")))
                                .build(),
                        VariableRequest.builder()
                                .name("profit")
                                .kind(VariableKind.TERMINAL)
                                .payoff(PROFIT)
                                .build()))
                .build();
    }

    private static BranchRequest decision(String name, double value, String successor) {
        return BranchRequest.builder().name(name).value(value).successor(successor).build();
    }

    private static BranchRequest chance(String name, double probability, double value, String successor) {
        return BranchRequest.builder()
                .name(name)
                .probability(probability)
                .value(value)
                .successor(successor)
                .build();
    }

    @Nested
    @DisplayName("Rollback")
    class Rollback {

        @Test
        @DisplayName("Risk-neutral rollback of the bid tree")
        void riskNeutral() {
            TreeEvaluationResponse response = service.rollback(RollbackRequest.builder().tree(bidTree()).build());

            assertThat(response.getRootName()).isEqualTo("bid");
            assertThat(response.getView()).isEqualTo(RollbackView.EV);
            assertThat(response.getRootValue()).isCloseTo(65.0, within(1e-9));
            assertThat(response.getNodeCount()).isEqualTo(27);
            assertThat(response.getOptimalPath()).containsExactly(0, 1);
            assertThat(response.getRiskTolerance()).isNull();

            TreeNodeResponse highBid = response.getNodes().get(14);
            assertThat(highBid.getTagBranch()).isEqualTo("high");
            assertThat(highBid.getExpectedValue()).isCloseTo(45.0, within(1e-9));
            assertThat(highBid.isOptimalStrategy()).isFalse();
        }

        @Test
        @DisplayName("Certainty-equivalent view with exponential utility")
        void certaintyEquivalent() {
            TreeEvaluationResponse response = service.rollback(RollbackRequest.builder()
                    .tree(bidTree())
                    .view(RollbackView.CE)
                    .utilityFunction(UtilityFunction.EXP)
                    .riskTolerance(75.0)
                    .build());

            assertThat(response.getView()).isEqualTo(RollbackView.CE);
            assertThat(response.getRootValue()).isCloseTo(11.197882577881296, within(1e-9));
            assertThat(response.getRootExpectedValue()).isCloseTo(45.0, within(1e-9));
            assertThat(response.getOptimalPath()).containsExactly(0, 14);
        }

        @Test
        @DisplayName("Active utility without a risk tolerance is rejected")
        void utilityNeedsTolerance() {
            RollbackRequest request = RollbackRequest.builder()
                    .tree(bidTree())
                    .utilityFunction(UtilityFunction.LOG)
                    .build();

            assertThatThrownBy(() -> service.rollback(request))
                    .isInstanceOfSatisfying(BusinessException.class, ex -> assertThat(ex.getErrorCode())
                            .isEqualTo(ErrorCode.INVALID_ARGUMENT));
        }

        @Test
        @DisplayName("Forced branch and alternative root from the request are honoured")
        void forcedBranchAndRoot() {
            TreeDefinitionRequest tree = bidTree();
            tree.getVariables().get(2).setForcedBranch("low");

            TreeEvaluationResponse forced = service.rollback(RollbackRequest.builder().tree(tree).build());
            assertThat(forced.getRootValue()).isCloseTo(195.0, within(1e-9));

            tree.setRoot("compbid");
            tree.getVariables().get(3).setPayoff(null);
            TreeEvaluationResponse rerooted = service.rollback(RollbackRequest.builder().tree(tree).build());
            assertThat(rerooted.getRootName()).isEqualTo("compbid");
            // sum of compbid and the forced 200 cost
            assertThat(rerooted.getRootValue()).isCloseTo(0.35 * 600 + 0.5 * 800 + 0.15 * 1000, within(1e-9));
        }

        @Test
        @DisplayName("Dependency tables in the request are applied")
        void dependencies() {
            TreeDefinitionRequest tree = bidTree();
            tree.setDependencies(List.of(DependencyRequest.builder()
                    .variable("cost")
                    .target(DependentTable.Target.PROBABILITY)
                    .dependsOn(List.of("compbid"))
                    .entries(List.of(
                            new DependencyRequest.Entry(List.of("low"), List.of(0.40, 0.40, 0.20)),
                            new DependencyRequest.Entry(List.of("medium"), List.of(0.25, 0.50, 0.25)),
                            new DependencyRequest.Entry(List.of("high"), List.of(0.10, 0.45, 0.45))))
                    .build()));

            TreeEvaluationResponse response = service.rollback(RollbackRequest.builder().tree(tree).build());

            assertThat(response.getRootValue()).isCloseTo(54.5, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Probability mode")
    class Mode {

        @Test
        @DisplayName("STRICT default rejects probabilities not summing to 1")
        void strictDefault() {
            TreeDefinitionRequest tree = bidTree();
            tree.getVariables().get(1).getBranches().get(0).setProbability(0.45);

            assertThatThrownBy(() -> service.rollback(RollbackRequest.builder().tree(tree).build()))
                    .isInstanceOf(MalformedDeclarationException.class);
        }

        @Test
        @DisplayName("NORMALIZE on the request rescales instead")
        void normalizeOverride() {
            TreeDefinitionRequest tree = bidTree();
            tree.setProbabilityMode(ProbabilityMode.NORMALIZE);
            tree.getVariables().get(2).getBranches().forEach(branch -> branch.setProbability(1.0));

            TreeEvaluationResponse response = service.rollback(RollbackRequest.builder().tree(tree).build());

            // cost becomes uniform over 200/400/600, same mean as 0.25/0.5/0.25
            assertThat(response.getRootValue()).isCloseTo(65.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Risk profile and sensitivity")
    class Analyses {

        @Test
        @DisplayName("Risk profile of the root split by bid")
        void riskProfile() {
            RiskProfileResponse response = service.riskProfile(RiskProfileRequest.builder()
                    .tree(bidTree())
                    .nodeIndex(0)
                    .single(false)
                    .build());

            assertThat(response.getSeries()).hasSize(2);
            assertThat(response.getSeries().get(0).getBranch()).isEqualTo("low");
            assertThat(response.getSeries().get(0).getTotalProbability()).isCloseTo(1.0, within(1e-9));
            assertThat(response.getSeries().get(1).getPoints()).hasSize(4);
        }

        @Test
        @DisplayName("Omitted risk-profile flags mean root, non-cumulative, per successor")
        void riskProfileDefaults() {
            RiskProfileResponse response = service.riskProfile(RiskProfileRequest.builder()
                    .tree(bidTree())
                    .build());

            assertThat(response.getNodeIndex()).isZero();
            assertThat(response.getSeries()).hasSize(2);
            assertThat(response.getSeries().get(0).getPoints().get(0).probability())
                    .isCloseTo(0.1625, within(1e-9));
        }

        @Test
        @DisplayName("Sweep sizes default to the configured point counts")
        void configuredPoints() {
            properties.setProbabilisticSensitivityPoints(5);

            SensitivityTableResponse response = service.probabilisticSensitivity(
                    ProbabilisticSensitivityRequest.builder().tree(bidTree()).variable("cost").build());

            assertThat(response.getRows()).hasSize(5);
            assertThat(response.getRows().get(4).values().get("low")).isCloseTo(195.0, within(1e-9));
        }

        @Test
        @DisplayName("Value sweep with explicit points")
        void valueSweep() {
            SensitivityTableResponse response = service.valueSensitivity(ValueSensitivityRequest.builder()
                    .tree(bidTree())
                    .variable("cost")
                    .branch("medium")
                    .minValue(200.0)
                    .maxValue(600.0)
                    .points(3)
                    .build());

            assertThat(response.getSeries()).containsExactly("low", "high");
            assertThat(response.getRows().get(0).values().get("low")).isCloseTo(130.0, within(1e-9));
        }

        @Test
        @DisplayName("Risk sweep labels the first row Infinity")
        void riskSweep() {
            SensitivityTableResponse response = service.riskSensitivity(RiskSensitivityRequest.builder()
                    .tree(bidTree())
                    .utilityFunction(UtilityFunction.EXP)
                    .riskTolerance(75.0)
                    .points(3)
                    .build());

            assertThat(response.getParameter()).isEqualTo("risk-aversion");
            assertThat(response.getRows().get(0).label()).isEqualTo("Infinity");
            assertThat(response.getRows().get(2).label()).isEqualTo("75");
        }
    }
}
