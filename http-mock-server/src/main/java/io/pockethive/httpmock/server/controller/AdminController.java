package io.pockethive.httpmock.server.controller;

import io.pockethive.httpmock.MockServer;
import io.pockethive.httpmock.RuleHandle;
import io.pockethive.httpmock.ServerState;
import io.pockethive.httpmock.model.MockDefinition;
import io.pockethive.httpmock.model.RecordedRequest;
import io.pockethive.httpmock.model.VerificationReport;
import io.pockethive.httpmock.server.model.MappingDefinition;
import io.pockethive.httpmock.server.model.RequestView;
import io.pockethive.httpmock.server.model.RuleView;
import io.pockethive.httpmock.server.model.VerificationView;
import io.pockethive.httpmock.server.service.MappingTranslator;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/__admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final MockServer server;
    private final MappingTranslator translator;

    public AdminController(MockServer server, MappingTranslator translator) {
        this.server = server;
        this.translator = translator;
    }

    @PostMapping("/mappings")
    public ResponseEntity<Map<String, String>> createMapping(@Valid @RequestBody MappingDefinition mapping) {
        MockDefinition definition;
        try {
            definition = translator.translate(mapping);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        RuleHandle handle;
        try {
            handle = server.mount(definition);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
        log.info("Mounted rule {} via admin API ({})", handle.id(), handle.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("status", "Created", "id", handle.id()));
    }

    @GetMapping("/mappings")
    public ResponseEntity<Map<String, Object>> getMappings() {
        List<RuleView> mappings = server.rules().stream().map(RuleView::from).toList();
        return ResponseEntity.ok(Map.of(
            "mappings", mappings,
            "meta", Map.of("total", mappings.size())
        ));
    }

    @DeleteMapping("/mappings/{id}")
    public ResponseEntity<Void> deleteMapping(@PathVariable("id") String id) {
        if (server.unmount(id)) {
            log.info("Unmounted rule {} via admin API", id);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/requests")
    public ResponseEntity<Map<String, Object>> getRequests() {
        return ResponseEntity.ok(requestsBody(server.requests()));
    }

    @GetMapping("/requests/unmatched")
    public ResponseEntity<Map<String, Object>> getUnmatchedRequests() {
        return ResponseEntity.ok(requestsBody(server.unmatchedRequests()));
    }

    @GetMapping("/verification")
    public ResponseEntity<VerificationView> verify() {
        VerificationReport report = server.verifyMounted();
        HttpStatus status = report.isSatisfied() ? HttpStatus.OK : HttpStatus.EXPECTATION_FAILED;
        return ResponseEntity.status(status).body(VerificationView.from(report));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        ServerState state = server.state();
        body.put("status", state == ServerState.RUNNING ? "UP" : "DOWN");
        body.put("state", state.name());
        if (state == ServerState.RUNNING) {
            body.put("address", server.baseUrl());
        }
        body.put("mappings", server.rules().size());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> requestsBody(List<RecordedRequest> requests) {
        return Map.of(
            "requests", requests.stream().map(RequestView::from).toList(),
            "meta", Map.of("total", requests.size())
        );
    }
}
