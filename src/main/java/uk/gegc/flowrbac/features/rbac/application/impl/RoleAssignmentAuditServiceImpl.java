package uk.gegc.flowrbac.features.rbac.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.rbac.application.RoleAssignmentAuditService;
import uk.gegc.flowrbac.features.rbac.application.store.AssignmentRecord;
import uk.gegc.flowrbac.features.rbac.domain.event.RoleAssignmentChangedEvent;
import uk.gegc.flowrbac.features.rbac.domain.model.RoleAssignmentAudit;
import uk.gegc.flowrbac.features.rbac.domain.repository.RoleAssignmentAuditRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class RoleAssignmentAuditServiceImpl implements RoleAssignmentAuditService {

    private final RoleAssignmentAuditRepository auditRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(RoleAssignmentChangedEvent event) {
        try {
            AssignmentRecord subject = event.getSubject();

            RoleAssignmentAudit audit = new RoleAssignmentAudit();
            audit.setAction(event.getAction());
            audit.setAssignmentId(subject.id());
            audit.setUserId(subject.userId());
            audit.setScopeType(subject.scopeType());
            audit.setScopeId(subject.scopeId());
            audit.setActorId(event.getActorId());
            audit.setBeforeState(toJson(event.getBefore()));
            audit.setAfterState(toJson(event.getAfter()));
            audit.setCreatedAt(event.getOccurredAt());

            auditRepository.save(audit);
            log.info("Audit logged: {} of role {} for user {} at {} {} by actor {}",
                    event.getAction(), subject.role().name(), subject.userId(),
                    subject.scopeType(), subject.scopeId(), event.getActorId() != null ? event.getActorId() : "system");
        } catch (Exception e) {
            log.error("Failed to log role assignment audit: {}", e.getMessage(), e);
            // The assignment change has already committed
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<RoleAssignmentAudit> getAssignmentHistory(UUID assignmentId) {
        return auditRepository.findByAssignmentIdOrderByCreatedAtAsc(assignmentId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RoleAssignmentAudit> getUserHistory(UUID userId) {
        return auditRepository.findByUserIdOrderByCreatedAtAsc(userId);
    }

    private String toJson(AssignmentRecord state) throws JsonProcessingException {
        if (state == null) {
            return null;
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("roleId", state.roleId().toString());
        snapshot.put("roleName", state.role().name());
        snapshot.put("scopeType", state.scopeType().getValue());
        snapshot.put("scopeId", state.scopeId() != null ? state.scopeId().toString() : null);
        snapshot.put("immutable", state.immutable());
        snapshot.put("createdBy", state.createdBy() != null ? state.createdBy().toString() : null);
        return objectMapper.writeValueAsString(snapshot);
    }
}
