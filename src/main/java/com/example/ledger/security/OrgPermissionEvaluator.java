package com.example.ledger.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.PermissionEvaluator;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Component;

import java.io.Serializable;

/**
 * Permission evaluator for organization-scoped checks.
 *
 * Identity and role assignment live outside the ledger; the authentication handed in is expected
 * to carry its permissions as granted authorities, either plain ({@code REOPEN_PERIOD}, valid in
 * every organization) or scoped ({@code REOPEN_PERIOD@42}). {@code ADMIN} grants everything.
 *
 * Supports two evaluation modes:
 * 1. hasPermission(authentication, null, 'PERMISSION_NAME') - plain authority only
 * 2. hasPermission(authentication, orgId, 'PERMISSION_NAME') - plain or scoped to that org
 */
@Component
public class OrgPermissionEvaluator implements PermissionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(OrgPermissionEvaluator.class);

    @Override
    public boolean hasPermission(Authentication authentication, Object targetDomainObject, Object permission) {
        if (authentication == null || !authentication.isAuthenticated() || permission == null) {
            return false;
        }

        String permissionName = permission.toString();

        if (targetDomainObject == null) {
            return hasGlobalPermission(authentication, permissionName);
        }

        if (targetDomainObject instanceof Long orgId) {
            return hasOrgPermission(authentication, orgId, permissionName);
        }

        log.warn("Unknown target domain object type: {}", targetDomainObject.getClass());
        return false;
    }

    @Override
    public boolean hasPermission(Authentication authentication, Serializable targetId,
                                 String targetType, Object permission) {
        if (authentication == null || !authentication.isAuthenticated() || permission == null) {
            return false;
        }

        String permissionName = permission.toString();

        if ("Organization".equals(targetType) && targetId instanceof Long orgId) {
            return hasOrgPermission(authentication, orgId, permissionName);
        }

        return hasGlobalPermission(authentication, permissionName);
    }

    private boolean hasGlobalPermission(Authentication authentication, String permissionName) {
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            String granted = authority.getAuthority();
            if (granted.equals(permissionName) || granted.equals(Permissions.ADMIN)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasOrgPermission(Authentication authentication, Long orgId, String permissionName) {
        if (hasGlobalPermission(authentication, permissionName)) {
            return true;
        }
        String scoped = Permissions.scoped(permissionName, orgId);
        String scopedAdmin = Permissions.scoped(Permissions.ADMIN, orgId);
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            String granted = authority.getAuthority();
            if (granted.equals(scoped) || granted.equals(scopedAdmin)) {
                return true;
            }
        }
        log.debug("User {} lacks {} in organization {}", authentication.getName(), permissionName, orgId);
        return false;
    }
}
