package com.deliverydispatch.dispatch.controller;

import com.deliverydispatch.dispatch.connection.ConnectionRegistry;
import com.deliverydispatch.dispatch.exception.DispatchErrorCode;
import com.deliverydispatch.dispatch.exception.DispatchException;
import com.deliverydispatch.dispatch.model.AssignmentRequest;
import com.deliverydispatch.dispatch.model.AssignmentResult;
import com.deliverydispatch.dispatch.model.ConnectionMetricsView;
import com.deliverydispatch.dispatch.model.DeliveryRequestView;
import com.deliverydispatch.dispatch.service.AssignmentEngine;
import com.deliverydispatch.shared.dto.ApiResponse;
import com.deliverydispatch.shared.model.GeoPoint;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/assignment")
@RequiredArgsConstructor
public class DispatchController {

    private final AssignmentEngine assignmentEngine;
    private final ConnectionRegistry connectionRegistry;

    @PostMapping("/request-assignment")
    public ResponseEntity<ApiResponse<AssignmentResult>> requestAssignment(@Valid @RequestBody AssignmentRequest request) {
        AssignmentResult result = assignmentEngine.assign(request.getRequestId(),
                GeoPoint.of(request.getLat(), request.getLon()));
        return ResponseEntity.ok(ApiResponse.ok(result));
    }

    @GetMapping("/status/{requestId}")
    public ResponseEntity<ApiResponse<DeliveryRequestView>> status(@PathVariable("requestId") long requestId) {
        DeliveryRequestView view = assignmentEngine.status(requestId)
                .orElseThrow(() -> new DispatchException(DispatchErrorCode.REQUEST_NOT_FOUND,
                        "Delivery request " + requestId + " not found"));
        return ResponseEntity.ok(ApiResponse.ok(view));
    }

    @PostMapping("/{requestId}/release")
    public ResponseEntity<ApiResponse<Void>> release(
            @PathVariable("requestId") long requestId,
            @RequestParam("driverId") long driverId) {

        if (!assignmentEngine.release(requestId, driverId)) {
            throw new DispatchException(DispatchErrorCode.CLAIM_NOT_HELD,
                    "Driver " + driverId + " holds no claim on request " + requestId);
        }
        return ResponseEntity.ok(ApiResponse.ok(null));
    }

    @PostMapping("/next")
    public ResponseEntity<ApiResponse<AssignmentResult>> assignNext(@RequestParam("driverId") long driverId) {
        return ResponseEntity.ok(ApiResponse.ok(assignmentEngine.assignNextFor(driverId).orElse(null)));
    }

    @GetMapping("/connections/metrics")
    public ResponseEntity<ApiResponse<ConnectionMetricsView>> connectionMetrics() {
        return ResponseEntity.ok(ApiResponse.ok(connectionRegistry.metrics()));
    }

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleDispatchException(DispatchException ex) {
        log.warn("Dispatch error [{}]: {}", ex.getCode(), ex.getMessage());
        HttpStatus status = switch (DispatchErrorCode.valueOf(ex.getCode())) {
            case REQUEST_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CLAIM_NOT_HELD -> HttpStatus.CONFLICT;
            case STORAGE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(ApiResponse.error(DispatchErrorCode.INVALID_EVENT.name(), message));
    }
}
