package uk.gegc.flowrbac.features.rbac.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;
import uk.gegc.flowrbac.features.rbac.api.dto.PermissionCheckItem;
import uk.gegc.flowrbac.features.rbac.api.dto.PermissionCheckRequest;
import uk.gegc.flowrbac.features.rbac.api.dto.PermissionCheckResult;
import uk.gegc.flowrbac.features.rbac.application.BatchPermissionChecker;
import uk.gegc.flowrbac.features.rbac.application.PermissionCheck;
import uk.gegc.flowrbac.features.rbac.application.PermissionQueryService;
import uk.gegc.flowrbac.shared.config.RbacProperties;
import uk.gegc.flowrbac.shared.exception.ValidationException;
import uk.gegc.flowrbac.shared.util.Identifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class PermissionQueryServiceImpl implements PermissionQueryService {

    private final BatchPermissionChecker batchPermissionChecker;
    private final RbacProperties properties;

    @Override
    public List<PermissionCheckResult> checkPermissions(String userId, PermissionCheckRequest request) {
        List<PermissionCheckItem> items = request.checks();
        int maxChecks = properties.getBatch().getMaxChecks();
        if (items.size() > maxChecks) {
            throw new ValidationException(String.format("At most %d checks are allowed per request, got %d",
                    maxChecks, items.size()));
        }

        UUID user = Identifiers.parseRequired(userId, "user_id");
        List<PermissionCheck> checks = items.stream()
                .map(item -> PermissionCheck.parse(item.action(), item.resourceType(), item.resourceId()))
                .toList();

        List<Boolean> allowed = batchPermissionChecker.batchCanAccess(user, checks);

        List<PermissionCheckResult> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            PermissionCheckItem item = items.get(i);
            results.add(new PermissionCheckResult(item.action(), item.resourceType(), item.resourceId(), allowed.get(i)));
        }
        return results;
    }
}
