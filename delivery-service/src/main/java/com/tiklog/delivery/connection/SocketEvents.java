package com.tiklog.delivery.connection;

/** 소켓 이벤트 이름 */
public final class SocketEvents {

    // 수신
    public static final String RIDER_ID = "riderId";
    public static final String CUSTOMER_ID = "customerId";
    public static final String PACKAGE_REQUEST = "packageRequest";
    public static final String DRIVER_RESPONSE = "driverResponse";
    public static final String ARRIVED = "arrived";
    public static final String START_DELIVERY = "startDelivery";
    public static final String END_DELIVERY = "endDelivery";
    public static final String NOTIFICATION_ACK = "notificationAck";
    public static final String RIDER_RESPONSE_NOTIFICATION_ACK = "riderResponseNotificationAck";

    // 발신
    public static final String NOTIFICATION = "notification";
    public static final String RIDER_RESPONSE = "riderResponse";
    public static final String RIDER_DECLINED = "riderDeclined";
    public static final String START_DELIVERY_NOTIFICATION = "startDeliveryNotification";
    public static final String END_DELIVERY_NOTIFICATION = "endDeliveryNotification";
    public static final String RIDER_ARRIVAL_NOTIFICATION = "riderArrivalNotification";
    public static final String REQUEST_ALREADY_SENT = "requestAlreadySent";
    public static final String ERROR = "error";

    private SocketEvents() {
    }
}
