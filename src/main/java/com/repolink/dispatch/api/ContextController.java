package com.repolink.dispatch.api;

import com.repolink.core.context.ContextSnapshot;
import com.repolink.core.context.ContextStore;
import com.repolink.core.context.SearchResult;
import com.repolink.core.error.RepolinkException;
import com.repolink.core.logging.MdcContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

import static com.repolink.dispatch.api.RequestValidation.requireBody;
import static com.repolink.dispatch.api.RequestValidation.requireText;

/**
 * REST controller for context lifecycle and search.
 */
@RestController
@RequestMapping("/v1")
public class ContextController {

    private final ContextStore contextStore;

    public ContextController(ContextStore contextStore) {
        this.contextStore = contextStore;
    }

    /**
     * POST /v1/init: Create an empty context.
     */
    @PostMapping("/init")
    public ResponseEntity<Map<String, String>> init() {
        String contextId = contextStore.create();
        return ResponseEntity.ok(Map.of("context_id", contextId));
    }

    /**
     * POST /v1/add_file: Stage or overwrite one file.
     */
    @PostMapping("/add_file")
    public ResponseEntity<Map<String, Object>> addFile(@RequestBody(required = false) AddFileRequest request) {
        requireBody(request);
        requireText(request.contextId(), "context_id");
        requireText(request.path(), "path");
        if (request.content() == null) {
            throw RepolinkException.validation("content is required");
        }

        MdcContext.setContext(request.contextId());
        try {
            contextStore.addFile(request.contextId(), request.path(), request.content(),
                    request.repo(), request.branch());
        } finally {
            MdcContext.clear();
        }
        return ResponseEntity.ok(Map.of("success", true));
    }

    /**
     * POST /v1/remove_file: Drop one staged file.
     */
    @PostMapping("/remove_file")
    public ResponseEntity<Map<String, Object>> removeFile(@RequestBody(required = false) RemoveFileRequest request) {
        requireBody(request);
        requireText(request.contextId(), "context_id");
        requireText(request.path(), "path");

        MdcContext.setContext(request.contextId());
        try {
            contextStore.removeFile(request.contextId(), request.path());
        } finally {
            MdcContext.clear();
        }
        return ResponseEntity.ok(Map.of("success", true));
    }

    /**
     * GET /v1/get_context?context_id=...: Live view of a context.
     */
    @GetMapping("/get_context")
    public ResponseEntity<ContextSnapshot> getContext(
            @RequestParam(name = "context_id", required = false) String contextId) {
        requireText(contextId, "context_id");
        return ResponseEntity.ok(contextStore.getContext(contextId));
    }

    /**
     * POST /v1/search: Case-insensitive substring search over staged files.
     */
    @PostMapping("/search")
    public ResponseEntity<SearchResult> search(@RequestBody(required = false) SearchRequest request) {
        requireBody(request);
        requireText(request.contextId(), "context_id");
        return ResponseEntity.ok(contextStore.search(request.contextId(), request.query()));
    }
}
