package com.decisionengine.mapper;

import com.decisionengine.api.dto.request.BranchRequest;
import com.decisionengine.variable.Branch;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from branch request DTOs to registry {@link Branch} values.
 * Variables themselves go through the registry's validating registration methods.
 */
@Mapper
public interface TreeDefinitionMapper {

    Branch toBranch(BranchRequest request);

    List<Branch> toBranches(List<BranchRequest> requests);
}
