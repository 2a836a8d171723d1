package com.dlxretry.exception;

/**
 * broker 连接/通道不可用
 * 对当前消费会话是致命的, 由 supervisor 退避后重连, 单条消息逻辑不处理
 */
public class BrokerConnectivityException extends RuntimeException {

    public BrokerConnectivityException(String message) {
        super(message);
    }

    public BrokerConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
