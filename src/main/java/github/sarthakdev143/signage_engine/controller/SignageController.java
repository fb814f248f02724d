package github.sarthakdev143.signage_engine.controller;

import github.sarthakdev143.signage_engine.dto.RescanResponse;
import github.sarthakdev143.signage_engine.dto.SignageStatusResponse;
import github.sarthakdev143.signage_engine.model.ContentSnapshot;
import github.sarthakdev143.signage_engine.model.RotationState;
import github.sarthakdev143.signage_engine.model.ScheduleWindow;
import github.sarthakdev143.signage_engine.model.TimedMediaEntry;
import github.sarthakdev143.signage_engine.service.ContentRefreshService;
import github.sarthakdev143.signage_engine.service.RotationClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/signage")
public class SignageController {

    private static final Logger logger = LoggerFactory.getLogger(SignageController.class);

    private final ContentRefreshService refreshService;
    private final RotationClock rotationClock;

    public SignageController(ContentRefreshService refreshService, RotationClock rotationClock) {
        this.refreshService = refreshService;
        this.rotationClock = rotationClock;
    }

    @GetMapping("/status")
    public SignageStatusResponse getStatus() {
        ContentSnapshot snapshot = refreshService.currentSnapshot();
        ScheduleWindow window = refreshService.activeWindow();
        RotationState rotation = rotationClock.currentState();

        return new SignageStatusResponse(
                window.name(),
                window.folder().toString(),
                window.transition(),
                rotation.active(),
                rotation.index(),
                rotation.current().map(TimedMediaEntry::filename).orElse(null),
                snapshot.catalog().size(),
                snapshot.managedState().scenes().size(),
                snapshot.publishedAt());
    }

    @PostMapping("/rescan")
    public ResponseEntity<RescanResponse> rescan() {
        try {
            refreshService.requestRescan("manual request");
            return ResponseEntity.accepted()
                    .body(new RescanResponse(true, "Rescan queued. Poll /api/signage/status for the result."));
        } catch (RuntimeException e) {
            logger.error("Could not queue manual rescan", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new RescanResponse(false, "Failed to queue rescan. Please try again."));
        }
    }
}
