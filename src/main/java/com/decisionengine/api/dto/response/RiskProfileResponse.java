package com.decisionengine.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskProfileResponse {

    private int nodeIndex;
    private boolean cumulative;
    private boolean single;
    private List<RiskProfileSeriesResponse> series;
}
