package com.dlxretry.exception;

/**
 * x-death / 重试计数头存在但无法解析
 */
public class MalformedDeathHistoryException extends RuntimeException {

    public MalformedDeathHistoryException(String message) {
        super(message);
    }
}
