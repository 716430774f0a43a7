/**
 * SessionEvent.java
 *
 * 该文件定义了一个通用的数据传输对象 (DTO)，用于封装所有通过WebSocket发送给某个会话客户端的事件。
 * 前端可以根据 'type' 字段来分发和处理不同类型的会话事件。
 */
package club.ppmc.runner.model;

/**
 * 发送到前端的会话事件。
 *
 * @param type 事件名称，取值见 {@link SessionEventType}。
 * @param data 事件负载。对于 "process_ended" 等简单通知，负载为空对象。
 * @param <T> 负载的泛型类型。
 */
public record SessionEvent<T>(String type, T data) {}
