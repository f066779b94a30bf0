package com.tiklog.delivery.controller;

import com.tiklog.common.dto.ApiResponse;
import com.tiklog.delivery.dto.DeliveryRequest;
import com.tiklog.delivery.dto.DeliveryResponse;
import com.tiklog.delivery.service.DeliveryService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 배달 API.
 *
 * <ul>
 *   <li>POST   /api/deliveries - 배송 생성 (견적 계산 + 지갑 차감)</li>
 *   <li>PUT    /api/deliveries/{id} - 배송 수정 (PENDING만, 차액 정산)</li>
 *   <li>DELETE /api/deliveries/{id} - 배송 취소 (환불)</li>
 *   <li>GET    /api/deliveries/{id}, /api/deliveries/customer/{customerId} - 조회</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/deliveries")
@RequiredArgsConstructor
public class DeliveryController {

    private final DeliveryService deliveryService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> createDelivery(@Valid @RequestBody DeliveryRequest request) {
        return ApiResponse.ok(DeliveryResponse.from(deliveryService.createDelivery(request)),
                "Delivery was successful");
    }

    @PutMapping("/{id}")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> editDelivery(@PathVariable Long id,
                                                      @Valid @RequestBody DeliveryRequest request) {
        return ApiResponse.ok(DeliveryResponse.from(deliveryService.editDelivery(id, request)),
                "Delivery updated successfully");
    }

    @DeleteMapping("/{id}")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> cancelDelivery(@PathVariable Long id) {
        return ApiResponse.ok(DeliveryResponse.from(deliveryService.cancelDelivery(id)),
                "Delivery canceled successfully");
    }

    /** 배달 ID로 배달 정보 조회 */
    @GetMapping("/{id}")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<DeliveryResponse> getDelivery(@PathVariable Long id) {
        return ApiResponse.ok(DeliveryResponse.from(deliveryService.getDelivery(id)));
    }

    /** 고객의 배달 목록 (최신순) */
    @GetMapping("/customer/{customerId}")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<List<DeliveryResponse>> getDeliveriesByCustomer(@PathVariable String customerId) {
        return ApiResponse.ok(deliveryService.getDeliveriesByCustomer(customerId).stream()
                .map(DeliveryResponse::from)
                .toList());
    }
}
