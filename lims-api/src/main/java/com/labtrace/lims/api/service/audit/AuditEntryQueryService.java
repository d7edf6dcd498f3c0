package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.api.config.AuditProperties;
import com.labtrace.lims.api.domain.AuditEntry;
import com.labtrace.lims.api.repository.AuditEntryRepository;
import com.labtrace.lims.api.service.error.RecordNotFoundException;
import jakarta.persistence.criteria.Predicate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the audit ledger: filtered pages, transaction-grouped pages and single entries.
 */
@Service
@Transactional(readOnly = true)
public class AuditEntryQueryService {

    private final AuditEntryRepository repository;
    private final AuditProperties properties;

    public AuditEntryQueryService(AuditEntryRepository repository, AuditProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public AuditPage<AuditEntryView> query(AuditSearchCriteria criteria, int page, int size) {
        Page<AuditEntry> result = repository.findAll(buildSpecification(criteria), pageRequest(page, size));
        List<AuditEntryView> content = result.getContent().stream().map(AuditEntryView::from).toList();
        return new AuditPage<>(content, result.getTotalElements(), result.getNumber(), result.getSize());
    }

    /**
     * Same filtering and paging as {@link #query}, with the page's entries merged by transaction tag.
     */
    public AuditPage<AuditGroupView> queryGrouped(AuditSearchCriteria criteria, int page, int size) {
        AuditPage<AuditEntryView> entries = query(criteria, page, size);
        return new AuditPage<>(group(entries.content()), entries.total(), entries.page(), entries.size());
    }

    public AuditEntryView getById(UUID id) {
        return repository.findById(id).map(AuditEntryView::from).orElseThrow(() -> new RecordNotFoundException("AuditEntry", id));
    }

    static List<AuditGroupView> group(List<AuditEntryView> entries) {
        Map<String, List<AuditEntryView>> buckets = new LinkedHashMap<>();
        for (AuditEntryView entry : entries) {
            String key = entry.transactionTag() != null ? "tx:" + entry.transactionTag() : "entry:" + entry.id();
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
        }
        Comparator<AuditEntryView> newestFirst = Comparator.comparing(AuditEntryView::at, Comparator.nullsLast(Comparator.reverseOrder()));
        List<AuditGroupView> groups = new ArrayList<>(buckets.size());
        for (List<AuditEntryView> members : buckets.values()) {
            List<AuditEntryView> ordered = members.stream().sorted(newestFirst).toList();
            AuditEntryView latest = ordered.get(0);
            String groupKey = latest.transactionTag() != null ? latest.transactionTag() : String.valueOf(latest.id());
            groups.add(
                new AuditGroupView(
                    groupKey,
                    latest.transactionTag(),
                    latest.at(),
                    latest.actorId(),
                    latest.actorEmail(),
                    latest.ip(),
                    latest.userAgent(),
                    ordered
                )
            );
        }
        groups.sort(Comparator.comparing(AuditGroupView::timestamp, Comparator.nullsLast(Comparator.reverseOrder())));
        return groups;
    }

    Pageable pageRequest(int page, int size) {
        int effectiveSize = size <= 0 ? properties.getDefaultPageSize() : Math.min(size, properties.getMaxPageSize());
        Sort sort = Sort.by(Sort.Order.desc("at"), Sort.Order.desc("id"));
        return PageRequest.of(Math.max(page, 0), effectiveSize, sort);
    }

    private static Specification<AuditEntry> buildSpecification(AuditSearchCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (criteria == null) {
                return cb.and(predicates.toArray(Predicate[]::new));
            }
            if (criteria.subjectType() != null) {
                predicates.add(cb.equal(root.get("subjectType"), criteria.subjectType()));
            }
            if (criteria.subjectId() != null) {
                predicates.add(cb.equal(root.get("subjectId"), criteria.subjectId()));
            }
            if (criteria.actorId() != null) {
                predicates.add(cb.equal(root.get("actorId"), criteria.actorId()));
            }
            if (criteria.action() != null) {
                predicates.add(cb.equal(root.get("action"), criteria.action()));
            }
            if (criteria.from() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("at"), criteria.from()));
            }
            if (criteria.to() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("at"), criteria.to()));
            }
            if (criteria.transactionTag() != null) {
                predicates.add(cb.equal(root.get("transactionTag"), criteria.transactionTag()));
            }
            return cb.and(predicates.toArray(Predicate[]::new));
        };
    }
}
