package com.bastion.indicator;

import com.bastion.audit.AuditAction;
import com.bastion.audit.AuditEvent;
import com.bastion.audit.AuditLevel;
import com.bastion.audit.AuditSink;
import com.bastion.classification.Classification;
import com.bastion.classification.IndicatorClassifier;
import com.bastion.domain.Indicator;
import com.bastion.domain.IndicatorNote;
import com.bastion.domain.IndicatorType;
import com.bastion.domain.PageResult;
import com.bastion.domain.ResourceNotFoundException;
import com.bastion.domain.WhitelistEntry;
import com.bastion.security.IdentityContext;
import com.bastion.security.RequestIdentity;
import com.bastion.storage.IndicatorNoteRepository;
import com.bastion.storage.IndicatorQuery;
import com.bastion.storage.IndicatorRepository;
import com.bastion.whitelist.WhitelistService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Analyst-facing indicator operations: manual entry, edits, temporary
 * activation and notes.
 *
 * Manual entries go through the same normalisation and whitelist check as
 * feed candidates.
 */
@Service
public class IndicatorService {

    private static final Logger log = LoggerFactory.getLogger(IndicatorService.class);

    static final int MIN_TEMP_ACTIVATION_HOURS = 1;
    static final int MAX_TEMP_ACTIVATION_HOURS = 168;

    private final IndicatorRepository indicatorRepository;
    private final IndicatorNoteRepository noteRepository;
    private final IndicatorClassifier classifier;
    private final WhitelistService whitelistService;
    private final AuditSink auditSink;
    private final Clock clock;

    public IndicatorService(IndicatorRepository indicatorRepository,
                            IndicatorNoteRepository noteRepository,
                            IndicatorClassifier classifier,
                            WhitelistService whitelistService,
                            AuditSink auditSink,
                            Clock clock) {
        this.indicatorRepository = indicatorRepository;
        this.noteRepository = noteRepository;
        this.classifier = classifier;
        this.whitelistService = whitelistService;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    public PageResult<Indicator> find(IndicatorQuery query) {
        return indicatorRepository.find(query);
    }

    public Indicator get(Long id) {
        return indicatorRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Indicator", id));
    }

    /**
     * @throws WhitelistedIndicatorException if the value is covered by the whitelist
     * @throws DuplicateIndicatorException   if (value, type) already exists
     */
    public Indicator create(IndicatorRequest request) {
        if (request.getType() == null || request.getType().isBlank()) {
            throw new IllegalArgumentException("Indicator type is required");
        }
        IndicatorType type = IndicatorType.fromValue(request.getType().trim());
        Classification normalized = classifier.normalize(request.getValue(), type);
        RequestIdentity who = IdentityContext.current();

        Optional<WhitelistEntry> match = whitelistService.matcher().match(normalized.getValue(), type);
        if (match.isPresent()) {
            auditSink.record(AuditEvent.builder(AuditAction.BLOCKED, AuditEvent.RESOURCE_INDICATOR)
                .level(AuditLevel.WARNING)
                .details("Blocked manual entry of whitelisted " + type.getValue() + " " + normalized.getValue())
                .userId(who.getUserId())
                .ipAddress(who.getIpAddress())
                .metadata("value", normalized.getValue())
                .metadata("whitelistEntryId", match.get().getId())
                .metadata("whitelistValue", match.get().getValue())
                .build());
            throw new WhitelistedIndicatorException(normalized.getValue(), match.get().getValue());
        }

        Instant now = clock.instant();
        Indicator indicator = Indicator.builder()
            .value(normalized.getValue())
            .type(type)
            .hashType(normalized.getHashType())
            .source(Indicator.MANUAL_SOURCE)
            .active(request.getIsActive() == null || request.getIsActive())
            .notes(request.getNotes())
            .createdAt(now)
            .createdBy(who.getUserId())
            .build();

        try {
            indicatorRepository.insert(indicator);
        } catch (DuplicateKeyException e) {
            throw new DuplicateIndicatorException(normalized.getValue(), type);
        }

        log.info("Indicator created manually: id={}, type={}, value={}", indicator.getId(), type, indicator.getValue());
        audit(AuditAction.CREATE, indicator.getId(), "Created indicator: " + indicator.getValue(), who);
        return indicator;
    }

    /**
     * Apply isActive and notes. Deactivating clears any temporary activation.
     */
    public Indicator update(Long id, IndicatorRequest request) {
        Indicator indicator = get(id);
        if (request.getIsActive() != null) {
            indicator.setActive(request.getIsActive());
        }
        if (request.getNotes() != null) {
            indicator.setNotes(request.getNotes());
        }
        if (!indicator.isActive()) {
            indicator.setTempActiveUntil(null);
        }

        Instant now = clock.instant();
        if (!indicatorRepository.update(indicator, now)) {
            throw new ResourceNotFoundException("Indicator", id);
        }
        indicator.setUpdatedAt(now);
        audit(AuditAction.UPDATE, id, "Updated indicator: " + indicator.getValue(), IdentityContext.current());
        return indicator;
    }

    public void delete(Long id) {
        Indicator indicator = get(id);
        if (indicatorRepository.deleteById(id) == 0) {
            throw new ResourceNotFoundException("Indicator", id);
        }
        audit(AuditAction.DELETE, id, "Deleted indicator: " + indicator.getValue(), IdentityContext.current());
    }

    /**
     * Activate for {@code durationHours} hours, after which the sweeper removes
     * the indicator.
     */
    public Indicator tempActivate(Long id, Integer durationHours) {
        if (durationHours == null || durationHours < MIN_TEMP_ACTIVATION_HOURS
                || durationHours > MAX_TEMP_ACTIVATION_HOURS) {
            throw new IllegalArgumentException("Duration must be between " + MIN_TEMP_ACTIVATION_HOURS
                + " and " + MAX_TEMP_ACTIVATION_HOURS + " hours");
        }
        Indicator indicator = get(id);

        Instant now = clock.instant();
        Instant until = now.plus(Duration.ofHours(durationHours));
        if (!indicatorRepository.activateUntil(id, until, now)) {
            throw new ResourceNotFoundException("Indicator", id);
        }
        indicator.setActive(true);
        indicator.setTempActiveUntil(until);
        indicator.setUpdatedAt(now);

        RequestIdentity who = IdentityContext.current();
        auditSink.record(AuditEvent.builder(AuditAction.TEMP_ACTIVATE, AuditEvent.RESOURCE_INDICATOR)
            .resourceId(id)
            .details("Temporarily activated indicator for " + durationHours + " hours until " + until)
            .userId(who.getUserId())
            .ipAddress(who.getIpAddress())
            .metadata("durationHours", durationHours)
            .metadata("expiresAt", until.toString())
            .build());
        return indicator;
    }

    public List<IndicatorNote> findNotes(Long indicatorId) {
        get(indicatorId);
        return noteRepository.findByIndicatorId(indicatorId);
    }

    public IndicatorNote addNote(Long indicatorId, String content) {
        RequestIdentity who = IdentityContext.current();
        Long userId = who.requireUserId();
        String text = requireContent(content);
        get(indicatorId);

        IndicatorNote note = noteRepository.insert(new IndicatorNote(indicatorId, userId, text), clock.instant());
        auditSink.record(AuditEvent.builder(AuditAction.CREATE, AuditEvent.RESOURCE_INDICATOR_NOTE)
            .resourceId(note.getId())
            .details("Added note to indicator " + indicatorId)
            .userId(userId)
            .ipAddress(who.getIpAddress())
            .build());
        return note;
    }

    /**
     * Only the author may edit a note.
     *
     * @throws NoteAccessDeniedException if the note is missing or belongs to someone else
     */
    public IndicatorNote updateNote(Long noteId, String content) {
        RequestIdentity who = IdentityContext.current();
        Long userId = who.requireUserId();
        String text = requireContent(content);

        if (!noteRepository.updateContent(noteId, userId, text, clock.instant())) {
            throw new NoteAccessDeniedException();
        }
        auditSink.record(AuditEvent.builder(AuditAction.UPDATE, AuditEvent.RESOURCE_INDICATOR_NOTE)
            .resourceId(noteId)
            .details("Edited indicator note")
            .userId(userId)
            .ipAddress(who.getIpAddress())
            .build());
        return noteRepository.findById(noteId).orElseThrow(NoteAccessDeniedException::new);
    }

    public void deleteNote(Long noteId) {
        RequestIdentity who = IdentityContext.current();
        Long userId = who.requireUserId();

        if (!noteRepository.delete(noteId, userId)) {
            throw new NoteAccessDeniedException();
        }
        auditSink.record(AuditEvent.builder(AuditAction.DELETE, AuditEvent.RESOURCE_INDICATOR_NOTE)
            .resourceId(noteId)
            .details("Deleted indicator note")
            .userId(userId)
            .ipAddress(who.getIpAddress())
            .build());
    }

    private void audit(AuditAction action, Long id, String details, RequestIdentity who) {
        auditSink.record(AuditEvent.builder(action, AuditEvent.RESOURCE_INDICATOR)
            .resourceId(id)
            .details(details)
            .userId(who.getUserId())
            .ipAddress(who.getIpAddress())
            .build());
    }

    private static String requireContent(String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Note content must not be empty");
        }
        return content.trim();
    }
}
