package com.tiklog.delivery.controller;

import com.tiklog.common.dto.ApiResponse;
import com.tiklog.delivery.dto.WalletFundRequest;
import com.tiklog.delivery.dto.WalletResponse;
import com.tiklog.delivery.service.DeliveryService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/** 고객 지갑 충전/잔액 조회 */
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
public class WalletController {

    private final DeliveryService deliveryService;

    @PostMapping("/{customerId}/fund")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<WalletResponse> fund(@PathVariable String customerId,
                                            @Valid @RequestBody WalletFundRequest request) {
        return ApiResponse.ok(WalletResponse.from(deliveryService.fundWallet(customerId, request.amount())));
    }

    @GetMapping("/{customerId}")
    @RateLimiter(name = "deliveryApi")
    public ApiResponse<WalletResponse> getWallet(@PathVariable String customerId) {
        return ApiResponse.ok(WalletResponse.from(deliveryService.getWallet(customerId)));
    }
}
