package com.tiklog.delivery.service;

import com.tiklog.delivery.repository.RiderDistance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tiklog.delivery.support.TestFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArrivalTimeEstimatorTest {

    private final RiderDistance near = new RiderDistance("r1", 1.0, 3.39, 6.45);
    private final RiderDistance selected = new RiderDistance("r2", 2.0, 3.40, 6.45);
    private final RiderDistance far = new RiderDistance("r3", 3.0, 3.41, 6.45);

    @Test
    @DisplayName("ALL_CANDIDATES - 반경 내 모든 후보의 이동 시간을 합산 (1+2+3km @30km/h = 12분)")
    void allCandidates_SumsEveryCandidate() {
        ArrivalTimeEstimator estimator = new ArrivalTimeEstimator(properties(EtaMode.ALL_CANDIDATES));

        assertThat(estimator.estimateMinutes(List.of(near, selected, far), selected, 30)).isEqualTo(12);
    }

    @Test
    @DisplayName("SELECTED_RIDER - 선택된 라이더만 (2km @30km/h = 4분)")
    void selectedRider_UsesOnlySelected() {
        ArrivalTimeEstimator estimator = new ArrivalTimeEstimator(properties(EtaMode.SELECTED_RIDER));

        assertThat(estimator.estimateMinutes(List.of(near, selected, far), selected, 30)).isEqualTo(4);
    }

    @Test
    @DisplayName("최소 2분 하한")
    void floorsAtMinimum() {
        ArrivalTimeEstimator estimator = new ArrivalTimeEstimator(properties(EtaMode.SELECTED_RIDER));
        RiderDistance veryClose = new RiderDistance("r1", 0.5, 3.39, 6.45);

        assertThat(estimator.estimateMinutes(List.of(veryClose), veryClose, 30)).isEqualTo(2);
    }

    @Test
    @DisplayName("HOUR_REMAINDER (기본) - 1시간을 넘으면 시간 단위는 버리고 나머지 분만 남는다 (45km @30km/h = 30분)")
    void hourRemainder_DropsWholeHours() {
        ArrivalTimeEstimator estimator = new ArrivalTimeEstimator(properties(EtaMode.SELECTED_RIDER));
        RiderDistance distant = new RiderDistance("r1", 45.0, 3.39, 6.45);

        assertThat(estimator.estimateMinutes(List.of(distant), distant, 30)).isEqualTo(30);
    }

    @Test
    @DisplayName("HOUR_REMAINDER - 정확히 1시간이면 0분이 되어 하한 2분이 적용된다")
    void hourRemainder_ExactHourFloors() {
        ArrivalTimeEstimator estimator = new ArrivalTimeEstimator(properties(EtaMode.SELECTED_RIDER));
        RiderDistance distant = new RiderDistance("r1", 30.0, 3.39, 6.45);

        assertThat(estimator.estimateMinutes(List.of(distant), distant, 30)).isEqualTo(2);
    }

    @Test
    @DisplayName("TOTAL - 1시간을 넘는 이동 시간도 총 분으로 환산 (45km @30km/h = 90분)")
    void total_KeepsHours() {
        ArrivalTimeEstimator estimator = new ArrivalTimeEstimator(
                properties(EtaMode.SELECTED_RIDER, EtaMinutes.TOTAL));
        RiderDistance distant = new RiderDistance("r1", 45.0, 3.39, 6.45);

        assertThat(estimator.estimateMinutes(List.of(distant), distant, 30)).isEqualTo(90);
    }

    @Test
    @DisplayName("속도가 0 이하이면 계산하지 않는다")
    void rejectsNonPositiveSpeed() {
        ArrivalTimeEstimator estimator = new ArrivalTimeEstimator(properties());

        assertThatThrownBy(() -> estimator.estimateMinutes(List.of(selected), selected, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
