package com.example.rabbitretry.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.rabbitretry.model.DrainedDeadLetter;
import com.example.rabbitretry.model.QueueDepth;
import com.example.rabbitretry.service.DeadLetterDrainer;
import com.example.rabbitretry.service.QueueInspector;

import lombok.extern.slf4j.Slf4j;

/**
 * 队列巡检控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/queues")
public class QueueController {

    private final QueueInspector queueInspector;
    private final DeadLetterDrainer deadLetterDrainer;

    public QueueController(QueueInspector queueInspector, DeadLetterDrainer deadLetterDrainer) {
        this.queueInspector = queueInspector;
        this.deadLetterDrainer = deadLetterDrainer;
    }

    /**
     * 查看死信队列和延迟队列的消息数
     * 
     * 示例请求：
     * GET http://localhost:8080/api/queues
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listQueues() {
        List<QueueDepth> report = queueInspector.report();
        log.info("\n{}", QueueInspector.renderTable(report));

        List<Map<String, Object>> rows = report.stream()
                .map(depth -> {
                    Map<String, Object> row = new HashMap<>();
                    row.put("queueName", depth.getQueueName());
                    row.put("messageCount", depth.isAvailable() ? depth.getMessageCount() : depth.display());
                    return row;
                })
                .collect(Collectors.toList());
        return ResponseEntity.ok(rows);
    }

    /**
     * 取出并确认死信（取出后死信队列中不再保留）
     * 
     * 示例请求：
     * POST http://localhost:8080/api/queues/dead-letters/drain?limit=10
     */
    @PostMapping("/dead-letters/drain")
    public ResponseEntity<Map<String, Object>> drainDeadLetters(@RequestParam(defaultValue = "100") int limit) {
        Map<String, Object> response = new HashMap<>();
        try {
            List<DrainedDeadLetter> drained = deadLetterDrainer.drain(limit);
            response.put("total", drained.size());
            response.put("messages", drained);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("取出死信异常: ", e);
            response.put("total", 0);
            response.put("message", "取出死信异常: " + e.getMessage());
            return ResponseEntity.internalServerError().body(response);
        }
    }
}
