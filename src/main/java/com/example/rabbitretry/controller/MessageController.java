package com.example.rabbitretry.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.rabbitretry.publisher.MessagePublisher;

import lombok.extern.slf4j.Slf4j;

/**
 * 消息控制器
 * 提供 REST API 用于发送测试消息
 */
@Slf4j
@RestController
@RequestMapping("/api/messages")
public class MessageController {

    private final MessagePublisher messagePublisher;

    public MessageController(MessagePublisher messagePublisher) {
        this.messagePublisher = messagePublisher;
    }

    /**
     * 发送消息
     * 
     * 示例请求：
     * POST http://localhost:8080/api/messages/send
     * Content-Type: application/json
     * 
     * {
     *   "routingKey": "warning",
     *   "content": "temporary_error - should retry 3 times then go to DLQ"
     * }
     */
    @PostMapping("/send")
    public ResponseEntity<Map<String, Object>> sendMessage(@RequestBody MessageRequest request) {
        Map<String, Object> response = new HashMap<>();

        String messageId = messagePublisher.send(request.getRoutingKey(), request.getContent());
        if (messageId != null) {
            response.put("success", true);
            response.put("messageId", messageId);
            return ResponseEntity.ok(response);
        }

        response.put("success", false);
        response.put("message", "消息发送失败（重试3次后仍然失败）");
        return ResponseEntity.status(500).body(response);
    }

    /**
     * 发送原始消息体（不是合法 JSON 时会直接进入死信队列）
     * 
     * 示例请求：
     * POST http://localhost:8080/api/messages/send-raw
     * Content-Type: application/json
     * 
     * {
     *   "routingKey": "error",
     *   "body": "invalid json {broken"
     * }
     */
    @PostMapping("/send-raw")
    public ResponseEntity<Map<String, Object>> sendRawMessage(@RequestBody RawMessageRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            String messageId = messagePublisher.sendRaw(request.getRoutingKey(), request.getBody());
            response.put("success", true);
            response.put("messageId", messageId);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("发送原始消息异常: ", e);
            response.put("success", false);
            response.put("message", "消息发送异常: " + e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    /**
     * 健康检查
     */
    @GetMapping("/health")
    public String health() {
        return "RabbitMQ Retry Service is running!";
    }

    // ========== 请求对象 ==========

    /**
     * 消息请求对象
     */
    public static class MessageRequest {
        private String routingKey;
        private String content;

        public MessageRequest() {}

        public MessageRequest(String routingKey, String content) {
            this.routingKey = routingKey;
            this.content = content;
        }

        public String getRoutingKey() {
            return routingKey;
        }

        public void setRoutingKey(String routingKey) {
            this.routingKey = routingKey;
        }

        public String getContent() {
            return content;
        }

        public void setContent(String content) {
            this.content = content;
        }
    }

    /**
     * 原始消息请求对象
     */
    public static class RawMessageRequest {
        private String routingKey;
        private String body;

        public RawMessageRequest() {}

        public RawMessageRequest(String routingKey, String body) {
            this.routingKey = routingKey;
            this.body = body;
        }

        public String getRoutingKey() {
            return routingKey;
        }

        public void setRoutingKey(String routingKey) {
            this.routingKey = routingKey;
        }

        public String getBody() {
            return body;
        }

        public void setBody(String body) {
            this.body = body;
        }
    }
}
