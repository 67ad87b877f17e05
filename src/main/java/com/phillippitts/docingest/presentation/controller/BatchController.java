package com.phillippitts.docingest.presentation.controller;

import com.phillippitts.docingest.domain.BatchSubmission;
import com.phillippitts.docingest.domain.BatchSummary;
import com.phillippitts.docingest.domain.ItemSnapshot;
import com.phillippitts.docingest.domain.SubmittedFile;
import com.phillippitts.docingest.exception.BatchAbortedException;
import com.phillippitts.docingest.exception.InvalidFileException;
import com.phillippitts.docingest.service.orchestration.BatchCoordinator;
import com.phillippitts.docingest.service.orchestration.BatchJob;
import com.phillippitts.docingest.service.orchestration.BatchListener;
import com.phillippitts.docingest.service.resolve.ResolutionCandidate;
import com.phillippitts.docingest.service.resolve.ResolutionKind;
import com.phillippitts.docingest.service.resolve.ResolutionRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Batch submission, inspection and decision endpoints.
 *
 * <p>Submission returns as soon as the batch is created; clients follow it by polling
 * {@code GET /api/batches/{id}} or by subscribing to {@code GET /api/batches/{id}/events}.
 */
@RestController
@RequestMapping("/api/batches")
public class BatchController {

    private static final Logger LOG = LogManager.getLogger(BatchController.class);

    /** SSE subscriptions stay open until the batch finishes or the client leaves. */
    static final long EVENTS_TIMEOUT_MS = 30L * 60 * 1000;

    private final BatchCoordinator coordinator;

    public BatchController(BatchCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmitResponse> submit(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                                 @RequestParam("category") String category) {
        if (files == null || files.isEmpty()) {
            throw new InvalidFileException("No files submitted");
        }
        List<SubmittedFile> selection = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            selection.add(toSubmittedFile(file));
        }
        BatchJob job = coordinator.submit(new BatchSubmission(selection, category));
        LOG.info("Accepted batch {} with {} files for category {}", job.getId(), selection.size(), category);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new SubmitResponse(job.getId(), selection.size(), job.summary()));
    }

    @GetMapping("/{batchId}")
    public BatchSummary summary(@PathVariable UUID batchId) {
        return coordinator.get(batchId).summary();
    }

    @GetMapping("/{batchId}/resolutions")
    public List<ResolutionView> resolutions(@PathVariable UUID batchId) {
        List<ResolutionView> views = new ArrayList<>();
        for (ResolutionRequest request : coordinator.get(batchId).openResolutions()) {
            views.add(ResolutionView.of(request));
        }
        return views;
    }

    /**
     * Records decisions on the open request of {@code kind}: either per entry
     * ({@code {"decisions": {"<entryKey>": true}}}, {@code true} = proceed) or in bulk
     * ({@code {"all": false}}).
     */
    @PostMapping("/{batchId}/resolutions/{kind}")
    public DecisionResponse decide(@PathVariable UUID batchId, @PathVariable String kind,
                                   @RequestBody DecisionRequest body) {
        ResolutionKind resolutionKind = ResolutionKind.fromWireName(kind);
        BatchJob job = coordinator.get(batchId);
        boolean resolved;
        if (body.all() != null) {
            resolved = job.decideAll(resolutionKind, body.all());
        } else if (body.decisions() != null && !body.decisions().isEmpty()) {
            resolved = job.decide(resolutionKind, body.decisions());
        } else {
            throw new IllegalArgumentException("Either 'decisions' or 'all' is required");
        }
        List<String> pending = resolved ? List.of()
                : job.openResolution(resolutionKind).map(ResolutionRequest::getPendingEntries).orElse(List.of());
        return new DecisionResponse(resolved, pending);
    }

    @GetMapping(path = "/{batchId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable UUID batchId) {
        BatchJob job = coordinator.get(batchId);
        SseEmitter emitter = new SseEmitter(EVENTS_TIMEOUT_MS);
        SseBatchListener listener = new SseBatchListener(job, emitter);
        emitter.onCompletion(() -> job.removeListener(listener));
        emitter.onTimeout(() -> job.removeListener(listener));
        emitter.onError(e -> job.removeListener(listener));

        job.addListener(listener);
        listener.send("summary", job.summary());
        for (ResolutionRequest request : job.openResolutions()) {
            listener.send("resolution", ResolutionView.of(request));
        }
        if (job.isFinished()) {
            emitter.complete();
        }
        return emitter;
    }

    @DeleteMapping("/{batchId}")
    public ResponseEntity<Void> release(@PathVariable UUID batchId) {
        coordinator.release(batchId);
        return ResponseEntity.noContent().build();
    }

    private static SubmittedFile toSubmittedFile(MultipartFile file) {
        try {
            return new SubmittedFile(file.getOriginalFilename(), file.getSize(), file.getBytes());
        } catch (IOException e) {
            throw new InvalidFileException(file.getOriginalFilename(), "Unreadable upload: " + e.getMessage());
        }
    }

    /**
     * Forwards batch callbacks to one SSE subscriber.
     */
    private static final class SseBatchListener implements BatchListener {

        private final BatchJob job;
        private final SseEmitter emitter;

        SseBatchListener(BatchJob job, SseEmitter emitter) {
            this.job = job;
            this.emitter = emitter;
        }

        @Override
        public void onItemUpdated(UUID batchId, ItemSnapshot item) {
            send("item", item);
        }

        @Override
        public void onResolutionRequested(ResolutionRequest request) {
            send("resolution", ResolutionView.of(request));
        }

        @Override
        public void onSettled(BatchSummary summary) {
            send("settled", summary);
            emitter.complete();
        }

        @Override
        public void onAborted(BatchSummary summary, BatchAbortedException failure) {
            send("aborted", summary);
            emitter.complete();
        }

        void send(String name, Object data) {
            try {
                emitter.send(SseEmitter.event().name(name).data(data, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                LOG.debug("SSE subscriber for batch {} gone: {}", job.getId(), e.toString());
                job.removeListener(this);
                emitter.completeWithError(e);
            }
        }
    }

    public record SubmitResponse(UUID batchId, int fileCount, BatchSummary summary) {}

    public record DecisionRequest(Map<String, Boolean> decisions, Boolean all) {}

    public record DecisionResponse(boolean resolved, List<String> pendingEntries) {}

    public record ResolutionView(UUID requestId, ResolutionKind kind, List<ResolutionCandidate> candidates,
                                 List<String> pendingEntries) {

        static ResolutionView of(ResolutionRequest request) {
            return new ResolutionView(request.getRequestId(), request.getKind(), request.getCandidates(),
                    request.getPendingEntries());
        }
    }
}
