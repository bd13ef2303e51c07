package com.bastion.api;

import com.bastion.domain.IndicatorType;
import com.bastion.domain.PageResult;
import com.bastion.domain.WhitelistBlock;
import com.bastion.domain.WhitelistEntry;
import com.bastion.whitelist.WhitelistCheckResult;
import com.bastion.whitelist.WhitelistRequest;
import com.bastion.whitelist.WhitelistService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/whitelist")
public class WhitelistController {

    private final WhitelistService whitelistService;

    public WhitelistController(WhitelistService whitelistService) {
        this.whitelistService = whitelistService;
    }

    @GetMapping
    public List<WhitelistEntry> list() {
        return whitelistService.findAll();
    }

    @PostMapping
    public ResponseEntity<WhitelistEntry> create(@Valid @RequestBody WhitelistRequest request) {
        WhitelistEntry entry = whitelistService.create(request.getValue(), parseType(request.getType()),
            request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        whitelistService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/check")
    public WhitelistCheckResult check(@Valid @RequestBody WhitelistRequest request) {
        return whitelistService.check(request.getValue(), parseType(request.getType()));
    }

    @GetMapping("/blocks")
    public PageResult<WhitelistBlock> blocks(@RequestParam(defaultValue = "1") int page,
                                             @RequestParam(defaultValue = "25") int limit) {
        return whitelistService.findBlocks(page, limit);
    }

    private static IndicatorType parseType(String type) {
        return type == null || type.isBlank() ? null : IndicatorType.fromValue(type.trim());
    }
}
