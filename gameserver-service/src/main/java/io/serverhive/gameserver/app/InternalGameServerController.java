package io.serverhive.gameserver.app;

import io.serverhive.gameserver.domain.GameServerCrashedException;
import io.serverhive.gameserver.domain.GameServerNotFoundException;
import io.serverhive.gameserver.domain.GameServerOperationException;
import io.serverhive.gameserver.domain.OwnershipViolationException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for lifecycle operations forwarded by peer nodes. Operations run against the local engine
 * without placement or further forwarding.
 */
@RestController
@RequestMapping("/internal/game-servers")
public class InternalGameServerController {
    private static final Logger log = LoggerFactory.getLogger(InternalGameServerController.class);

    private final GameServerOrchestrator orchestrator;

    public InternalGameServerController(GameServerOrchestrator orchestrator) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    @PostMapping("/{id}/create")
    public ResponseEntity<OperationResponse> create(@PathVariable String id) {
        String containerId = orchestrator.createLocally(id);
        return ResponseEntity.ok(new OperationResponse(id, RemoteOperation.CREATE.pathSegment(), containerId));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<OperationResponse> start(@PathVariable String id) {
        orchestrator.startLocally(id);
        return ok(id, RemoteOperation.START);
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<OperationResponse> stop(@PathVariable String id) {
        orchestrator.stopLocally(id);
        return ok(id, RemoteOperation.STOP);
    }

    @PostMapping("/{id}/restart")
    public ResponseEntity<OperationResponse> restart(@PathVariable String id) {
        orchestrator.restartLocally(id);
        return ok(id, RemoteOperation.RESTART);
    }

    @PostMapping("/{id}/delete")
    public ResponseEntity<OperationResponse> delete(@PathVariable String id) {
        orchestrator.deleteLocally(id);
        return ok(id, RemoteOperation.DELETE);
    }

    @PostMapping("/{id}/command")
    public ResponseEntity<OperationResponse> command(@PathVariable String id, @RequestBody CommandRequest request) {
        orchestrator.sendCommandLocally(id, request == null ? null : request.command());
        return ok(id, RemoteOperation.COMMAND);
    }

    @ExceptionHandler(GameServerNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(GameServerNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex, null);
    }

    @ExceptionHandler(OwnershipViolationException.class)
    public ResponseEntity<ErrorResponse> ownership(OwnershipViolationException ex) {
        return error(HttpStatus.CONFLICT, ex, null);
    }

    @ExceptionHandler(GameServerCrashedException.class)
    public ResponseEntity<ErrorResponse> crashed(GameServerCrashedException ex) {
        return error(HttpStatus.CONFLICT, ex, ex.getExitCode());
    }

    @ExceptionHandler(GameServerOperationException.class)
    public ResponseEntity<ErrorResponse> failed(GameServerOperationException ex) {
        log.warn("forwarded operation on game server {} failed: {}", ex.getGameServerId(), ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(null, ex.getMessage(), null));
    }

    private static ResponseEntity<OperationResponse> ok(String id, RemoteOperation operation) {
        return ResponseEntity.ok(new OperationResponse(id, operation.pathSegment(), null));
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, GameServerOperationException ex,
                                                       Long exitCode) {
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getGameServerId(), ex.getMessage(), exitCode));
    }

    public record CommandRequest(String command) {}

    public record OperationResponse(String gameServerId, String operation, String containerId) {}

    public record ErrorResponse(String gameServerId, String error, Long exitCode) {}
}
