package info.mouts.orderpipeline.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import info.mouts.orderpipeline.dto.OrderNotificationDTO;
import info.mouts.orderpipeline.util.RabbitMqUtils;

@JsonTest
public class OrderEventJsonTest {
    @Autowired
    private ObjectMapper objectMapper;

    private Map<String, Object> toMap(Object value) throws Exception {
        return objectMapper.readValue(objectMapper.writeValueAsString(value),
                new TypeReference<Map<String, Object>>() {
                });
    }

    @Test
    @DisplayName("Application mapper should keep null order fields")
    void serialize_nullField_shouldBeKept() throws Exception {
        OrderEvent event = RabbitMqUtils.createFakeOrderEvent(42, OrderStatus.ORDERED).with("note", null);

        Map<String, Object> json = toMap(event);

        assertTrue(json.containsKey("note"));
        assertNull(json.get("note"));
        assertEquals(42, json.get("order_no"));
    }

    @Test
    @DisplayName("Notifications should omit the error of a successful delivery")
    void serialize_deliveredNotification_shouldOmitError() throws Exception {
        OrderNotificationDTO notification = OrderNotificationDTO.builder()
                .type(OrderNotificationDTO.ORDER_DELIVERED)
                .message("Your order has been delivered")
                .order(RabbitMqUtils.createFakeOrderEvent(42, OrderStatus.DELIVERED))
                .build();

        Map<String, Object> json = toMap(notification);

        assertFalse(json.containsKey("error"));
        assertEquals("ORDER_DELIVERED", json.get("type"));
    }
}
