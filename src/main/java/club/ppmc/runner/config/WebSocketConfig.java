/**
 * WebSocketConfig.java
 *
 * 配置Spring WebSocket和STOMP消息代理。
 * 该类负责定义WebSocket端点，配置消息代理（broker），并设置心跳机制以保持连接稳定。
 * 每个STOMP会话ID即为一个客户端会话ID，执行会话的事件发送到 /topic/session/{sessionId}/... 下。
 */
package club.ppmc.runner.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    /**
     * 配置消息代理（Message Broker）。
     *
     * <p>
     * 1. <b>Simple Broker</b>: 使用 `/topic` 和 `/queue` 作为消息前缀。
     * 2. <b>Heartbeat</b>: STOMP协议层面的心跳（10秒发送，10秒接收），用于检测已断开的客户端，
     *    断开后其执行会话会被 WebSocketSessionListener 清理。
     * 3. <b>Application Destination</b>: `/app` 是客户端发送消息到 @MessageMapping 的前缀。
     * </p>
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("ws-heartbeat-thread-");
        taskScheduler.initialize();

        config.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[] {10000, 10000}) // 10秒心跳
                .setTaskScheduler(taskScheduler);
        config.setApplicationDestinationPrefixes("/app");
    }

    /**
     * 注册STOMP端点 `/ws`。
     * 启用 SockJS 以兼容不支持WebSocket的网络环境，并设置传输层心跳防止代理超时断开。
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry
                .addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS()
                .setHeartbeatTime(25000);
    }
}
