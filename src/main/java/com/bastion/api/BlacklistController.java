package com.bastion.api;

import com.bastion.export.BlacklistExportService;
import com.bastion.export.ExportReport;
import com.bastion.export.PublishedFile;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Manual regeneration plus the public listing of published blacklist files.
 * The files themselves are served statically under /public/blacklist/.
 */
@RestController
@RequestMapping("/api")
public class BlacklistController {

    private final BlacklistExportService exportService;

    public BlacklistController(BlacklistExportService exportService) {
        this.exportService = exportService;
    }

    @PostMapping("/blacklist/refresh")
    public ExportReport refresh() {
        return exportService.regenerate();
    }

    @GetMapping("/public/blacklist/files")
    public Map<String, List<PublishedFile>> files() {
        return exportService.listPublishedFiles();
    }

    @GetMapping("/public/blacklist/stats")
    public Map<String, Object> stats() {
        return exportService.stats();
    }
}
