package uk.gegc.flowrbac.shared.security.aspect;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;
import uk.gegc.flowrbac.shared.exception.ValidationException;
import uk.gegc.flowrbac.shared.security.ScopeAccessPolicy;
import uk.gegc.flowrbac.shared.security.annotation.RequireScopePermission;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.UUID;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ScopePermissionAspect {

    private final ScopeAccessPolicy accessPolicy;

    @Before("@annotation(requireScopePermission)")
    public void checkScopePermission(JoinPoint joinPoint, RequireScopePermission requireScopePermission) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        UUID userId = uuidArgument(method, joinPoint.getArgs(), requireScopePermission.userParam());
        UUID scopeId = uuidArgument(method, joinPoint.getArgs(), requireScopePermission.scopeParam());

        if (scopeId == null) {
            if (requireScopePermission.optional()) {
                return;
            }
            throw new ValidationException(requireScopePermission.scopeParam() + " is required");
        }

        accessPolicy.requirePermission(userId, requireScopePermission.permission(),
                requireScopePermission.scope(), scopeId);
    }

    private UUID uuidArgument(Method method, Object[] args, String name) {
        Parameter[] parameters = method.getParameters();
        for (int i = 0; i < parameters.length; i++) {
            if (parameters[i].getName().equals(name)) {
                Object value = args[i];
                if (value == null || value instanceof UUID) {
                    return (UUID) value;
                }
                throw new IllegalStateException(String.format("Parameter '%s' of %s is not a UUID",
                        name, method.getName()));
            }
        }
        log.error("Parameter '{}' not found on {}; compile with -parameters", name, method);
        throw new IllegalStateException("Parameter '" + name + "' not found on " + method.getName());
    }
}
