package io.relay.core.permission;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Operator answer to a pending permission request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PermissionResponse(boolean approved, String reason, Map<String, Object> updatedInput) {

    public static PermissionResponse approve() {
        return new PermissionResponse(true, null, null);
    }

    public static PermissionResponse deny(String reason) {
        return new PermissionResponse(false, reason, null);
    }
}
