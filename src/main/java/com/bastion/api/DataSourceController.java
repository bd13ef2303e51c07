package com.bastion.api;

import com.bastion.datasource.DataSourceRequest;
import com.bastion.datasource.DataSourceService;
import com.bastion.domain.DataSource;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/data-sources")
public class DataSourceController {

    private final DataSourceService dataSourceService;

    public DataSourceController(DataSourceService dataSourceService) {
        this.dataSourceService = dataSourceService;
    }

    @GetMapping
    public List<DataSource> list() {
        return dataSourceService.findAll();
    }

    @GetMapping("/{id}")
    public DataSource get(@PathVariable Long id) {
        return dataSourceService.get(id);
    }

    @PostMapping
    public ResponseEntity<DataSource> create(@Valid @RequestBody DataSourceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(dataSourceService.create(request));
    }

    @PutMapping("/{id}")
    public DataSource update(@PathVariable Long id, @Valid @RequestBody DataSourceRequest request) {
        return dataSourceService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        dataSourceService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/pause")
    public DataSource pause(@PathVariable Long id) {
        return dataSourceService.pause(id);
    }

    @PostMapping("/{id}/resume")
    public DataSource resume(@PathVariable Long id) {
        return dataSourceService.resume(id);
    }

    /**
     * Starts a fetch and returns immediately; the run continues in the background.
     */
    @PostMapping("/{id}/fetch")
    public ResponseEntity<Map<String, Object>> fetch(@PathVariable Long id) {
        DataSource source = dataSourceService.fetchNow(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Fetch started for " + source.getName());
        body.put("dataSourceId", source.getId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }
}
