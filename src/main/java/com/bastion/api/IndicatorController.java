package com.bastion.api;

import com.bastion.domain.Indicator;
import com.bastion.domain.IndicatorNote;
import com.bastion.domain.IndicatorType;
import com.bastion.domain.PageResult;
import com.bastion.indicator.IndicatorRequest;
import com.bastion.indicator.IndicatorService;
import com.bastion.indicator.NoteRequest;
import com.bastion.indicator.TempActivationRequest;
import com.bastion.storage.IndicatorQuery;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class IndicatorController {

    private final IndicatorService indicatorService;

    public IndicatorController(IndicatorService indicatorService) {
        this.indicatorService = indicatorService;
    }

    @GetMapping("/indicators")
    public PageResult<Indicator> list(@RequestParam(required = false) String type,
                                      @RequestParam(required = false) String source,
                                      @RequestParam(required = false) Boolean isActive,
                                      @RequestParam(required = false) String search,
                                      @RequestParam(defaultValue = "1") int page,
                                      @RequestParam(defaultValue = "50") int limit) {
        IndicatorQuery query = new IndicatorQuery()
            .type(type == null || type.isBlank() ? null : IndicatorType.fromValue(type.trim()))
            .source(source)
            .active(isActive)
            .search(search)
            .page(page)
            .limit(limit);
        return indicatorService.find(query);
    }

    @GetMapping("/indicators/{id}")
    public Indicator get(@PathVariable Long id) {
        return indicatorService.get(id);
    }

    @PostMapping("/indicators")
    public ResponseEntity<Indicator> create(@Valid @RequestBody IndicatorRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(indicatorService.create(request));
    }

    @PutMapping("/indicators/{id}")
    public Indicator update(@PathVariable Long id, @Valid @RequestBody IndicatorRequest request) {
        return indicatorService.update(id, request);
    }

    @DeleteMapping("/indicators/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        indicatorService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/indicators/{id}/temp-activate")
    public Indicator tempActivate(@PathVariable Long id, @Valid @RequestBody TempActivationRequest request) {
        return indicatorService.tempActivate(id, request.getDurationHours());
    }

    @GetMapping("/indicators/{id}/notes")
    public List<IndicatorNote> notes(@PathVariable Long id) {
        return indicatorService.findNotes(id);
    }

    @PostMapping("/indicators/{id}/notes")
    public ResponseEntity<IndicatorNote> addNote(@PathVariable Long id, @Valid @RequestBody NoteRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(indicatorService.addNote(id, request.getContent()));
    }

    @PutMapping("/indicator-notes/{noteId}")
    public IndicatorNote updateNote(@PathVariable Long noteId, @Valid @RequestBody NoteRequest request) {
        return indicatorService.updateNote(noteId, request.getContent());
    }

    @DeleteMapping("/indicator-notes/{noteId}")
    public ResponseEntity<Void> deleteNote(@PathVariable Long noteId) {
        indicatorService.deleteNote(noteId);
        return ResponseEntity.noContent().build();
    }
}
