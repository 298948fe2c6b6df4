package com.decisionengine.mapper;

import com.decisionengine.api.dto.response.RiskProfileResponse;
import com.decisionengine.api.dto.response.RiskProfileSeriesResponse;
import com.decisionengine.api.dto.response.SensitivityTableResponse;
import com.decisionengine.api.dto.response.TreeNodeResponse;
import com.decisionengine.domain.model.RiskProfileReport;
import com.decisionengine.domain.model.RiskProfileSeries;
import com.decisionengine.domain.model.SensitivityTable;
import com.decisionengine.domain.model.TreeNode;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from computed tree results to REST response DTOs.
 *
 * <p>Read-only direction only: responses are never mapped back into the engine.
 * Payoff contexts and per-node risk profile maps stay internal.
 */
@Mapper
public interface DecisionTreeResponseMapper {

    TreeNodeResponse toResponse(TreeNode node);

    List<TreeNodeResponse> toNodeResponses(List<TreeNode> nodes);

    RiskProfileResponse toResponse(RiskProfileReport report);

    @Mapping(target = "totalProbability", expression = "java(series.totalProbability())")
    RiskProfileSeriesResponse toResponse(RiskProfileSeries series);

    SensitivityTableResponse toResponse(SensitivityTable table);
}
