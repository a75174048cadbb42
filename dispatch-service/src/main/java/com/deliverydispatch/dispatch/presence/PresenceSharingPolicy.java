package com.deliverydispatch.dispatch.presence;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.shared.enums.UserRole;
import com.deliverydispatch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether a user's presence is broadcast to every authenticated connection or only
 * to their own sockets and administrators.
 */
@Component
@RequiredArgsConstructor
public class PresenceSharingPolicy {

    private final DispatchProperties properties;
    private final FeatureFlagService featureFlagService;

    public boolean sharesPublicly(UserRole role) {
        return role != null
                && properties.getPresence().getPublicRoles().contains(role)
                && featureFlagService.isEnabled(FeatureFlagService.PRESENCE_PUBLIC_SHARING, true);
    }
}
