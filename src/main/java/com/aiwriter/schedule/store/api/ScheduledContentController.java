package com.aiwriter.schedule.store.api;

import com.aiwriter.schedule.store.service.ContentStoreService;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping(path = "/api/scheduled-content", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "contentsched.store", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledContentController {

    private final ContentStoreService store;

    public ScheduledContentController(ContentStoreService store) {
        this.store = store;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Map<String, Object>> create(@Valid @RequestBody ScheduledContentRequest req) {
        return store.create(req)
                .map(r -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("id", r.id());
                    body.put("entity", r.entity());
                    body.put("schedule", r.schedule());
                    body.put("createdOn", r.createdOn());
                    return body;
                });
    }
}
