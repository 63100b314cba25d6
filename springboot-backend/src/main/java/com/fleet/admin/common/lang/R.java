package com.fleet.admin.common.lang;

import lombok.Data;

import java.io.Serializable;

/**
 * 统一响应结构，code 为 0 表示成功
 */
@Data
public class R implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int SUCCESS_CODE = 0;
    public static final int ERROR_CODE = -1;

    private int code;
    private String msg;
    private Object data;
    private long ts = System.currentTimeMillis();

    public static R ok() {
        return ok(null);
    }

    public static R ok(Object data) {
        R r = new R();
        r.setCode(SUCCESS_CODE);
        r.setMsg("操作成功");
        r.setData(data);
        return r;
    }

    public static R err(String msg) {
        return err(ERROR_CODE, msg);
    }

    public static R err(int code, String msg) {
        R r = new R();
        r.setCode(code);
        r.setMsg(msg);
        return r;
    }
}
