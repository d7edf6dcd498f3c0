package com.labtrace.lims.common.security.policy;

import static com.labtrace.lims.common.security.policy.LabAction.APPROVE;
import static com.labtrace.lims.common.security.policy.LabAction.ASSIGN;
import static com.labtrace.lims.common.security.policy.LabAction.CREATE;
import static com.labtrace.lims.common.security.policy.LabAction.EDIT_RESULTS;
import static com.labtrace.lims.common.security.policy.LabAction.EXPORT;
import static com.labtrace.lims.common.security.policy.LabAction.FINALIZE;
import static com.labtrace.lims.common.security.policy.LabAction.GENERATE_DRAFT;
import static com.labtrace.lims.common.security.policy.LabAction.READ;
import static com.labtrace.lims.common.security.policy.LabAction.UPDATE;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Static role-to-permission matrix.
 * <ul>
 *   <li>ADMIN: everything</li>
 *   <li>LAB_MANAGER: QA reviewer, releases samples, finalizes/approves/exports reports, reads the audit log</li>
 *   <li>ANALYST: edits samples and results, generates report drafts</li>
 *   <li>SALES_ACCOUNTING and CLIENT: read-only on samples, tests and reports</li>
 * </ul>
 */
public class RoleMatrixAccessPolicy implements LabAccessPolicy {

    @Override
    public AccessDecision authorize(Collection<String> authorities, LabAction action, LabResource resource) {
        boolean anyRole = false;
        for (String authority : authorities == null ? Set.<String>of() : authorities) {
            LabRole role = LabRole.fromAuthority(authority).orElse(null);
            if (role == null) {
                continue;
            }
            anyRole = true;
            if (allowedActions(role, resource).contains(action)) {
                return AccessDecision.allow();
            }
        }
        if (!anyRole) {
            return AccessDecision.deny("No laboratory role granted");
        }
        return AccessDecision.deny("Role does not have permission to " + action + " " + resource);
    }

    Set<LabAction> allowedActions(LabRole role, LabResource resource) {
        if (role == LabRole.ADMIN) {
            return EnumSet.allOf(LabAction.class);
        }
        return switch (resource) {
            case SAMPLE -> switch (role) {
                case LAB_MANAGER -> EnumSet.of(CREATE, READ, UPDATE, APPROVE);
                case ANALYST -> EnumSet.of(CREATE, READ, UPDATE);
                default -> EnumSet.of(READ);
            };
            case TEST_ASSIGNMENT -> switch (role) {
                case LAB_MANAGER -> EnumSet.of(READ, UPDATE, ASSIGN, EDIT_RESULTS, APPROVE);
                case ANALYST -> EnumSet.of(READ, UPDATE, ASSIGN, EDIT_RESULTS);
                default -> EnumSet.of(READ);
            };
            case REPORT -> switch (role) {
                case LAB_MANAGER -> EnumSet.of(READ, GENERATE_DRAFT, FINALIZE, APPROVE, EXPORT);
                case ANALYST -> EnumSet.of(READ, GENERATE_DRAFT);
                default -> EnumSet.of(READ);
            };
            case AUDIT_LOG -> role == LabRole.LAB_MANAGER ? EnumSet.of(READ) : EnumSet.noneOf(LabAction.class);
            case SETTINGS -> role == LabRole.LAB_MANAGER ? EnumSet.of(READ, UPDATE) : EnumSet.noneOf(LabAction.class);
        };
    }
}
