package com.bastion.whitelist;

import com.bastion.audit.AuditAction;
import com.bastion.audit.AuditEvent;
import com.bastion.audit.AuditSink;
import com.bastion.classification.Classification;
import com.bastion.classification.IndicatorClassifier;
import com.bastion.domain.IndicatorType;
import com.bastion.domain.PageResult;
import com.bastion.domain.ResourceNotFoundException;
import com.bastion.domain.WhitelistBlock;
import com.bastion.domain.WhitelistEntry;
import com.bastion.security.IdentityContext;
import com.bastion.security.RequestIdentity;
import com.bastion.storage.WhitelistBlockRepository;
import com.bastion.storage.WhitelistRepository;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Whitelist management and the cached matcher snapshot used by ingestion.
 *
 * The snapshot is rebuilt at most once per TTL, and immediately after any
 * create or delete on this node.
 */
@Service
public class WhitelistService {

    private static final Logger log = LoggerFactory.getLogger(WhitelistService.class);

    private static final String SNAPSHOT_KEY = "whitelist";

    private final WhitelistRepository whitelistRepository;
    private final WhitelistBlockRepository blockRepository;
    private final IndicatorClassifier classifier;
    private final AuditSink auditSink;
    private final Clock clock;
    private final LoadingCache<String, WhitelistMatcher> snapshot;

    public WhitelistService(WhitelistRepository whitelistRepository,
                            WhitelistBlockRepository blockRepository,
                            IndicatorClassifier classifier,
                            AuditSink auditSink,
                            Clock clock,
                            @Value("${bastion.whitelist.cache-ttl:30s}") Duration cacheTtl) {
        this.whitelistRepository = whitelistRepository;
        this.blockRepository = blockRepository;
        this.classifier = classifier;
        this.auditSink = auditSink;
        this.clock = clock;
        this.snapshot = Caffeine.newBuilder()
            .maximumSize(1)
            .expireAfterWrite(cacheTtl)
            .build(key -> loadMatcher());
    }

    /**
     * Current matcher snapshot. Callers should take it once per run and reuse it.
     */
    public WhitelistMatcher matcher() {
        return snapshot.get(SNAPSHOT_KEY);
    }

    public List<WhitelistEntry> findAll() {
        return whitelistRepository.findAll();
    }

    public WhitelistEntry create(String value, IndicatorType type, String reason) {
        if (type == null) {
            throw new IllegalArgumentException("Whitelist type is required");
        }
        if (type == IndicatorType.IP && value != null && value.contains("/") && !CidrRange.isValid(value.trim())) {
            throw new IllegalArgumentException("Invalid CIDR notation (e.g., 192.168.1.0/24): " + value);
        }
        Classification normalized = classifier.normalize(value, type);

        RequestIdentity who = IdentityContext.current();
        WhitelistEntry entry = new WhitelistEntry(null, normalized.getValue(), type,
            reason == null || reason.isBlank() ? null : reason.trim());
        entry.setCreatedBy(who.getUserId());

        try {
            whitelistRepository.insert(entry, clock.instant());
        } catch (DuplicateKeyException e) {
            throw new DuplicateWhitelistEntryException(entry.getValue());
        }
        invalidate();

        log.info("Whitelist entry added: id={}, type={}, value={}", entry.getId(), type, entry.getValue());
        auditSink.record(AuditEvent.builder(AuditAction.CREATE, AuditEvent.RESOURCE_WHITELIST)
            .resourceId(entry.getId())
            .details("Added to whitelist: " + entry.getValue())
            .userId(who.getUserId())
            .ipAddress(who.getIpAddress())
            .build());
        return entry;
    }

    public void delete(Long id) {
        if (!whitelistRepository.deleteById(id)) {
            throw new ResourceNotFoundException("Whitelist entry", id);
        }
        invalidate();

        RequestIdentity who = IdentityContext.current();
        log.info("Whitelist entry removed: id={}", id);
        auditSink.record(AuditEvent.builder(AuditAction.DELETE, AuditEvent.RESOURCE_WHITELIST)
            .resourceId(id)
            .details("Removed from whitelist")
            .userId(who.getUserId())
            .ipAddress(who.getIpAddress())
            .build());
    }

    /**
     * Check a value against the whitelist. When no type is given the value is
     * classified first, the same way a feed line would be.
     */
    public WhitelistCheckResult check(String value, IndicatorType type) {
        Classification candidate;
        if (type != null) {
            candidate = classifier.normalize(value, type);
        } else {
            Optional<Classification> detected = value == null ? Optional.empty()
                : classifier.classify(value.trim(), EnumSet.allOf(IndicatorType.class), false);
            candidate = detected.orElseThrow(() ->
                new IllegalArgumentException("Could not determine indicator type for: " + value));
        }

        WhitelistEntry match = matcher().match(candidate.getValue(), candidate.getType()).orElse(null);
        return new WhitelistCheckResult(candidate.getValue(), candidate.getType(), match);
    }

    public void recordBlock(WhitelistBlock block) {
        blockRepository.insert(block);
    }

    public PageResult<WhitelistBlock> findBlocks(int page, int limit) {
        return blockRepository.findPage(page, limit);
    }

    public void invalidate() {
        snapshot.invalidateAll();
    }

    private WhitelistMatcher loadMatcher() {
        List<WhitelistEntry> entries = whitelistRepository.findAll();
        log.debug("Loaded whitelist snapshot with {} entries", entries.size());
        return new WhitelistMatcher(entries);
    }
}
