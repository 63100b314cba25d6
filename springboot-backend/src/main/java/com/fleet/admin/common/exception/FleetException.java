package com.fleet.admin.common.exception;

/**
 * 配置生成链路中的业务异常基类
 */
public class FleetException extends RuntimeException {

    public FleetException(String message) {
        super(message);
    }

    public FleetException(String message, Throwable cause) {
        super(message, cause);
    }
}
