package com.tiklog.delivery.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 라이더(Rider) 엔티티.
 *
 * <p>배차 엔진은 접속 상태({@code status})와 활성 여부({@code active})만 읽고,
 * 배송 시작/종료 시 {@code busy} 플래그만 변경한다. 라이더 CRUD는 다른 서비스 책임이다.</p>
 */
@Entity
@Table(name = "riders")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Rider {

    @Id
    private String id;  // 참여자 식별자 (연결 레지스트리 키와 동일)

    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private String gender;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RiderStatus status;

    private boolean active;

    private boolean busy;

    @Builder
    public Rider(String id, String firstName, String lastName, String email, String phone,
                 String gender, RiderStatus status, boolean active) {
        this.id = id;
        this.firstName = firstName;
        this.lastName = lastName;
        this.email = email;
        this.phone = phone;
        this.gender = gender;
        this.status = status;
        this.active = active;
    }

    /** 탐색 후보 자격: 온라인이면서 활성 상태 */
    public boolean isDispatchable() {
        return status == RiderStatus.ONLINE && active;
    }

    public void markBusy() {
        this.busy = true;
    }

    public void markAvailable() {
        this.busy = false;
    }
}
