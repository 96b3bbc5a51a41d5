package com.example.ledger.service;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.FiscalPeriod;
import com.example.ledger.exception.DuplicateOverlapException;
import com.example.ledger.exception.ForbiddenException;
import com.example.ledger.exception.InvalidStateException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.PeriodLockedException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.FiscalPeriodRepository;
import com.example.ledger.security.OrgPermissionEvaluator;
import com.example.ledger.security.Permissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fiscal period administration and the lock check every date-stamped posting goes through.
 *
 * Workflow: OPEN → CLOSED → LOCKED. LOCKED always blocks postings; CLOSED only blocks them when
 * {@code ledger.periods.enforce-closed} is set, otherwise the posting goes through with a warning.
 * Reopening is privileged and audited.
 */
@Service
@Transactional
public class FiscalPeriodService {

    private static final Logger log = LoggerFactory.getLogger(FiscalPeriodService.class);

    static final int MIN_REOPEN_REASON_LENGTH = 10;

    private final FiscalPeriodRepository periodRepository;
    private final AuditService auditService;
    private final OrgPermissionEvaluator permissionEvaluator;
    private final LedgerProperties properties;

    public FiscalPeriodService(FiscalPeriodRepository periodRepository,
                               AuditService auditService,
                               OrgPermissionEvaluator permissionEvaluator,
                               LedgerProperties properties) {
        this.periodRepository = periodRepository;
        this.auditService = auditService;
        this.permissionEvaluator = permissionEvaluator;
        this.properties = properties;
    }

    /**
     * Creates an OPEN period. Ranges are inclusive on both ends and may not overlap another
     * period of the same organization.
     */
    public FiscalPeriod createPeriod(Long orgId, String name, LocalDate startsAt, LocalDate endsAt,
                                     Long userId) {
        validateRange(name, startsAt, endsAt);
        assertNoOverlap(orgId, startsAt, endsAt, null);

        FiscalPeriod period = periodRepository.save(new FiscalPeriod(orgId, name, startsAt, endsAt));

        auditService.logEvent(orgId, userId, "PERIOD_CREATED", "FiscalPeriod", period.getId(),
            "Created period " + name + " (" + startsAt + " to " + endsAt + ")");
        return period;
    }

    /**
     * Renames or re-dates a period that is still OPEN.
     */
    public FiscalPeriod updatePeriod(Long orgId, Long periodId, String name, LocalDate startsAt,
                                     LocalDate endsAt, Long userId) {
        FiscalPeriod period = getPeriod(orgId, periodId);
        if (!period.isOpen()) {
            throw new InvalidStateException("Period " + period.getName() + " is " + period.getStatus()
                + "; only OPEN periods can be edited");
        }
        validateRange(name, startsAt, endsAt);
        assertNoOverlap(orgId, startsAt, endsAt, periodId);

        period.setName(name);
        period.setStartsAt(startsAt);
        period.setEndsAt(endsAt);
        period = periodRepository.save(period);

        auditService.logEvent(orgId, userId, "PERIOD_UPDATED", "FiscalPeriod", periodId,
            "Updated period " + name + " (" + startsAt + " to " + endsAt + ")");
        return period;
    }

    public void deletePeriod(Long orgId, Long periodId, Long userId) {
        FiscalPeriod period = getPeriod(orgId, periodId);
        if (!period.isOpen()) {
            throw new InvalidStateException("Period " + period.getName() + " is " + period.getStatus()
                + "; only OPEN periods can be deleted");
        }
        periodRepository.delete(period);

        auditService.logEvent(orgId, userId, "PERIOD_DELETED", "FiscalPeriod", periodId,
            "Deleted period " + period.getName());
    }

    public FiscalPeriod closePeriod(Long orgId, Long periodId, Long userId) {
        FiscalPeriod period = getPeriod(orgId, periodId);
        if (!period.isOpen()) {
            throw new InvalidStateException("Period " + period.getName() + " is " + period.getStatus()
                + "; only OPEN periods can be closed");
        }
        period.close(userId);
        period = periodRepository.save(period);

        log.info("Closed fiscal period {} for org {}", period.getName(), orgId);
        auditService.logEvent(orgId, userId, "PERIOD_CLOSED", "FiscalPeriod", periodId,
            "Closed period " + period.getName());
        return period;
    }

    public FiscalPeriod lockPeriod(Long orgId, Long periodId, Long userId) {
        FiscalPeriod period = getPeriod(orgId, periodId);
        if (!period.isClosed()) {
            throw new InvalidStateException("Period " + period.getName() + " is " + period.getStatus()
                + "; only CLOSED periods can be locked");
        }
        period.lock(userId);
        period = periodRepository.save(period);

        log.info("Locked fiscal period {} for org {}", period.getName(), orgId);
        auditService.logEvent(orgId, userId, "PERIOD_LOCKED", "FiscalPeriod", periodId,
            "Locked period " + period.getName());
        return period;
    }

    /**
     * Reopens a CLOSED or LOCKED period for the user in the current security context.
     */
    public FiscalPeriod reopenPeriod(Long orgId, Long periodId, Long userId, String reason) {
        return reopenPeriod(orgId, periodId, userId, reason,
            SecurityContextHolder.getContext().getAuthentication());
    }

    /**
     * Reopens a CLOSED or LOCKED period. Requires {@link Permissions#REOPEN_PERIOD} in the
     * organization and a written reason.
     *
     * @throws ForbiddenException if the caller lacks the reopen capability
     */
    public FiscalPeriod reopenPeriod(Long orgId, Long periodId, Long userId, String reason,
                                     Authentication authentication) {
        if (!permissionEvaluator.hasPermission(authentication, orgId, Permissions.REOPEN_PERIOD)) {
            throw new ForbiddenException("Reopening a fiscal period requires the "
                + Permissions.REOPEN_PERIOD + " permission");
        }
        if (reason == null || reason.trim().length() < MIN_REOPEN_REASON_LENGTH) {
            throw new ValidationException("A reason of at least " + MIN_REOPEN_REASON_LENGTH
                + " characters is required to reopen a period");
        }

        FiscalPeriod period = getPeriod(orgId, periodId);
        if (period.isOpen()) {
            throw new InvalidStateException("Period " + period.getName() + " is already OPEN");
        }
        FiscalPeriod.Status previous = period.getStatus();
        period.reopen(userId, reason.trim());
        period = periodRepository.save(period);

        log.warn("Reopened fiscal period {} for org {} (was {})", period.getName(), orgId, previous);
        auditService.logEvent(orgId, userId, "PERIOD_REOPENED", "FiscalPeriod", periodId,
            "Reopened period " + period.getName() + ": " + reason.trim(),
            Map.of("previousStatus", previous.name(), "reason", reason.trim()));
        return period;
    }

    @Transactional(readOnly = true)
    public List<FiscalPeriod> listPeriods(Long orgId) {
        return periodRepository.findByOrgIdOrderByStartsAt(orgId);
    }

    @Transactional(readOnly = true)
    public FiscalPeriod getPeriod(Long orgId, Long periodId) {
        return periodRepository.findByIdAndOrgId(periodId, orgId)
            .orElseThrow(() -> new NotFoundException("Fiscal period not found: " + periodId));
    }

    @Transactional(readOnly = true)
    public Optional<FiscalPeriod> findPeriodFor(Long orgId, LocalDate date) {
        return periodRepository.findByOrgIdAndDate(orgId, date);
    }

    /** True when {@code date} falls in a LOCKED period of the organization. */
    @Transactional(readOnly = true)
    public boolean isLocked(Long orgId, LocalDate date) {
        return periodRepository.findByOrgIdAndDate(orgId, date)
            .map(FiscalPeriod::isLocked)
            .orElse(false);
    }

    /**
     * Throws unless a posting dated {@code date} is allowed.
     *
     * @throws PeriodLockedException if the date is in a LOCKED period, or a CLOSED one while
     *         closed periods are enforced
     * @throws ValidationException if no period covers the date and a period is required
     */
    @Transactional(readOnly = true)
    public void assertPostable(Long orgId, LocalDate date) {
        Optional<FiscalPeriod> found = periodRepository.findByOrgIdAndDate(orgId, date);
        if (found.isEmpty()) {
            if (properties.getPeriods().isRequirePeriod()) {
                throw new ValidationException("No fiscal period covers " + date);
            }
            return;
        }

        FiscalPeriod period = found.get();
        if (period.isLocked()) {
            throw new PeriodLockedException(date, period.getName(), period.getStatus().name());
        }
        if (period.isClosed()) {
            if (properties.getPeriods().isEnforceClosed()) {
                throw new PeriodLockedException(date, period.getName(), period.getStatus().name());
            }
            log.warn("Posting on {} lands in CLOSED period {} for org {}", date, period.getName(), orgId);
        }
    }

    private void validateRange(String name, LocalDate startsAt, LocalDate endsAt) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Period name is required");
        }
        if (startsAt == null || endsAt == null) {
            throw new ValidationException("Period start and end dates are required");
        }
        if (endsAt.isBefore(startsAt)) {
            throw new ValidationException("Period end " + endsAt + " is before its start " + startsAt);
        }
    }

    private void assertNoOverlap(Long orgId, LocalDate startsAt, LocalDate endsAt, Long ignoreId) {
        for (FiscalPeriod other : periodRepository.findOverlapping(orgId, startsAt, endsAt)) {
            if (ignoreId != null && ignoreId.equals(other.getId())) {
                continue;
            }
            throw new DuplicateOverlapException("Period " + startsAt + " to " + endsAt
                + " overlaps existing period " + other.getName() + " (" + other.getStartsAt()
                + " to " + other.getEndsAt() + ")");
        }
    }
}
