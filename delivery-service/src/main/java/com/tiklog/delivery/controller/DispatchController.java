package com.tiklog.delivery.controller;

import com.tiklog.common.dto.ApiResponse;
import com.tiklog.common.event.DriverResponse;
import com.tiklog.common.event.PackageRequest;
import com.tiklog.delivery.dto.DiscoveryResult;
import com.tiklog.delivery.dto.RiderLocationRequest;
import com.tiklog.delivery.service.AssignmentOutcome;
import com.tiklog.delivery.service.DispatchService;
import com.tiklog.delivery.service.DriverResponseRelay;
import com.tiklog.delivery.service.RiderDiscoveryService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * 배차 API.
 *
 * <ul>
 *   <li>GET  /api/dispatch/riders/nearest?customerId= - 라이더 탐색 (없으면 404 ProblemDetail)</li>
 *   <li>PUT  /api/dispatch/riders/{riderId}/location - 라이더 위치 갱신</li>
 *   <li>DELETE /api/dispatch/riders/{riderId}/location - 탐색 대상에서 제외</li>
 *   <li>POST /api/dispatch/package-requests - 배송 요청 제출</li>
 *   <li>POST /api/dispatch/driver-responses - 라이더 수락/거절</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/dispatch")
@RequiredArgsConstructor
public class DispatchController {

    private final RiderDiscoveryService riderDiscoveryService;
    private final DispatchService dispatchService;
    private final DriverResponseRelay driverResponseRelay;

    @GetMapping("/riders/nearest")
    @RateLimiter(name = "dispatchApi")
    public ApiResponse<DiscoveryResult> findRider(@RequestParam String customerId) {
        DiscoveryResult result = riderDiscoveryService.findRider(customerId);
        return ApiResponse.ok(result, result.arrivalMessage());
    }

    @PutMapping("/riders/{riderId}/location")
    public ApiResponse<Void> updateLocation(@PathVariable String riderId,
                                            @Valid @RequestBody RiderLocationRequest request) {
        riderDiscoveryService.updateRiderLocation(riderId, request.longitude(), request.latitude());
        return ApiResponse.ok(null, "Location updated");
    }

    @DeleteMapping("/riders/{riderId}/location")
    public ApiResponse<Void> removeLocation(@PathVariable String riderId) {
        riderDiscoveryService.removeRiderLocation(riderId);
        return ApiResponse.ok(null, "Location removed");
    }

    @PostMapping("/package-requests")
    @RateLimiter(name = "dispatchApi")
    public ApiResponse<AssignmentOutcome> submitPackageRequest(@RequestBody PackageRequest request) {
        return ApiResponse.ok(dispatchService.submitPackageRequest(request));
    }

    @PostMapping("/driver-responses")
    public ApiResponse<DriverResponse> sendDriverResponse(@RequestBody DriverResponse response) {
        return ApiResponse.ok(driverResponseRelay.sendDriverResponse(response));
    }
}
