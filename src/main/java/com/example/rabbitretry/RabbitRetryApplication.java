package com.example.rabbitretry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RabbitMQ 延迟重试 + 死信 应用主类
 * 
 * 功能说明：
 * 1. 消费失败分类：成功 / 临时失败 / 永久失败 / 消息解析失败 / 未知异常
 * 2. 指数退避延迟重试：借助 TTL + 死信交换机实现，进程内不做任何定时
 * 3. 死信兜底：重试耗尽或不可恢复的消息进入死信队列
 * 4. 队列巡检：查看重试队列和死信队列的堆积情况
 */
@SpringBootApplication
public class RabbitRetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RabbitRetryApplication.class, args);
    }
}
