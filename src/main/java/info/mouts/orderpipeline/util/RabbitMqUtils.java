package info.mouts.orderpipeline.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import info.mouts.orderpipeline.domain.OrderEvent;
import info.mouts.orderpipeline.domain.OrderStatus;

public class RabbitMqUtils {
    public static final String DEFAULT_EXCHANGE = "";
    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final int PERSISTENT_DELIVERY_MODE = 2;

    public static final String CLIENT_ID_HEADER = "X-Client-Id";
    public static final String CLIENT_ID_QUERY_PARAM = "clientId";

    public static final String WELCOME_MESSAGE = "Connection Established: Started taking order updates...";

    public static OrderEvent createFakeOrderEvent(int orderNo, OrderStatus status) {
        Map<String, Object> fields = new LinkedHashMap<>();

        fields.put("order_no", orderNo);
        fields.put("items", List.of("margherita", "diavola"));
        fields.put(OrderEvent.ORDER_STATUS_FIELD, status.name());

        return new OrderEvent(fields);
    }
}
