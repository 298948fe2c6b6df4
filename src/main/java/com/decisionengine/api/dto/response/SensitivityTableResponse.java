package com.decisionengine.api.dto.response;

import com.decisionengine.domain.model.SensitivityRow;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A sensitivity sweep: {@code rows[i].values} holds one entry per name in {@code series}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SensitivityTableResponse {

    private String parameter;
    private List<String> series;
    private List<SensitivityRow> rows;
}
