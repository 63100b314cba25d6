package com.fleet.admin.common.exception;

import com.fleet.admin.common.lang.R;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public R handleValidException(MethodArgumentNotValidException e) {
        return R.err(firstFieldMessage(e.getBindingResult().getFieldError()));
    }

    @ExceptionHandler(BindException.class)
    public R handleBindException(BindException e) {
        return R.err(firstFieldMessage(e.getBindingResult().getFieldError()));
    }

    @ExceptionHandler(PortExhaustionException.class)
    public R handlePortExhaustion(PortExhaustionException e) {
        log.warn("端口分配失败: {}", e.getMessage());
        return R.err(e.getMessage());
    }

    @ExceptionHandler(FleetException.class)
    public R handleFleetException(FleetException e) {
        log.error("业务异常: {}", e.getMessage());
        return R.err(e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public R handleException(Exception e) {
        log.error("系统异常", e);
        return R.err("系统异常，请稍后重试");
    }

    private String firstFieldMessage(FieldError fieldError) {
        return fieldError != null ? fieldError.getDefaultMessage() : "参数校验失败";
    }
}
