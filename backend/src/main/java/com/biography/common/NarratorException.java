package com.biography.common;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 文本生成协作方调用异常
 *
 * 可重试的特征：限流(429)、超时(408)、5xx、网络/连接错误
 */
public class NarratorException extends RuntimeException {

    private final Integer statusCode;

    public NarratorException(String message) {
        this(message, null, null);
    }

    public NarratorException(String message, Integer statusCode) {
        this(message, statusCode, null);
    }

    public NarratorException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return isTransient(this);
    }

    /**
     * 判断任意异常是否属于瞬时错误
     */
    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof NarratorException) {
                Integer status = ((NarratorException) current).getStatusCode();
                if (status != null && (status == 429 || status == 408 || status >= 500)) {
                    return true;
                }
            }
            if (current instanceof SocketTimeoutException
                || current instanceof ConnectException
                || current instanceof TimeoutException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("rate limit") || lower.contains("timeout") || lower.contains("timed out")
                    || lower.contains("network") || lower.contains("econnreset")
                    || lower.contains("connection reset") || lower.contains("service unavailable")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
