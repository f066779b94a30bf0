package com.tiklog.delivery.entity;

import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.tiklog.delivery.support.TestFixtures.delivery;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeliveryTest {

    @Test
    @DisplayName("정상 흐름 - PENDING → ASSIGNED → ON_TRANSIT → DELIVERED")
    void fullLifecycle() {
        Delivery delivery = delivery(1L, "cust-1", BigDecimal.valueOf(100));
        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.PENDING);

        delivery.assignRider("rider-1");
        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.ASSIGNED);
        assertThat(delivery.getRiderId()).isEqualTo("rider-1");

        delivery.startTransit();
        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.ON_TRANSIT);

        delivery.complete();
        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
    }

    @Test
    @DisplayName("수락 전에는 배송을 시작할 수 없다")
    void startTransit_FromPending_Rejected() {
        Delivery delivery = delivery(1L, "cust-1", BigDecimal.valueOf(100));

        assertThatThrownBy(delivery::startTransit)
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_DELIVERY_STATUS);
        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.PENDING);
    }

    @Test
    @DisplayName("단계를 건너뛰어 완료할 수 없다 - PENDING/ASSIGNED → DELIVERED 불가")
    void complete_SkippingStages_Rejected() {
        Delivery pending = delivery(1L, "cust-1", BigDecimal.valueOf(100));
        Delivery assigned = delivery(2L, "cust-1", BigDecimal.valueOf(100));
        assigned.assignRider("rider-1");

        assertThatThrownBy(pending::complete).isInstanceOf(BusinessException.class);
        assertThatThrownBy(assigned::complete).isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("종료 상태에서는 어떤 전이도 허용하지 않는다")
    void terminalStates_AreFinal() {
        Delivery delivered = delivery(1L, "cust-1", BigDecimal.valueOf(100));
        delivered.assignRider("rider-1");
        delivered.startTransit();
        delivered.complete();

        Delivery canceled = delivery(2L, "cust-1", BigDecimal.valueOf(100));
        canceled.cancel();

        assertThatThrownBy(delivered::cancel).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> canceled.assignRider("rider-1")).isInstanceOf(BusinessException.class);
        assertThat(DeliveryStatus.DELIVERED.canTransitionTo(DeliveryStatus.CANCELED)).isFalse();
        assertThat(DeliveryStatus.CANCELED.canTransitionTo(DeliveryStatus.PENDING)).isFalse();
    }

    @Test
    @DisplayName("같은 라이더의 중복 수락은 무시, 다른 라이더의 수락은 거부")
    void assignRider_Twice() {
        Delivery delivery = delivery(1L, "cust-1", BigDecimal.valueOf(100));
        delivery.assignRider("rider-1");

        delivery.assignRider("rider-1");

        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.ASSIGNED);
        assertThatThrownBy(() -> delivery.assignRider("rider-2")).isInstanceOf(BusinessException.class);
        assertThat(delivery.getRiderId()).isEqualTo("rider-1");
    }

    @Test
    @DisplayName("배송 시작 후에는 취소할 수 없다")
    void cancel_AfterTransit_Rejected() {
        assertThat(DeliveryStatus.PENDING.canTransitionTo(DeliveryStatus.CANCELED)).isTrue();
        assertThat(DeliveryStatus.ASSIGNED.canTransitionTo(DeliveryStatus.CANCELED)).isTrue();
        assertThat(DeliveryStatus.ON_TRANSIT.canTransitionTo(DeliveryStatus.CANCELED)).isFalse();
    }

    @Test
    @DisplayName("수정은 PENDING에서만 - 라이더 수락 후에는 DELIVERY_NOT_EDITABLE")
    void edit_OnlyWhilePending() {
        Delivery delivery = delivery(1L, "cust-1", BigDecimal.valueOf(100));

        delivery.edit("Ada", "1 New Rd", "9 Other St", 6.5, 3.4, 6.6, 3.5,
                VehicleType.CAR, BigDecimal.valueOf(300), "0hrs:20min");

        assertThat(delivery.getSenderAddress()).isEqualTo("1 New Rd");
        assertThat(delivery.getDeliveryFee()).isEqualByComparingTo("300");
        assertThat(delivery.getVehicleType()).isEqualTo(VehicleType.CAR);

        delivery.assignRider("rider-1");
        assertThatThrownBy(() -> delivery.edit("Ada", "a", "b", 0, 0, 0, 0, null, BigDecimal.ONE, "0hrs:1min"))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.DELIVERY_NOT_EDITABLE);
    }
}
