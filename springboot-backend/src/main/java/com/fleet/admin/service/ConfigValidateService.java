package com.fleet.admin.service;

import com.alibaba.fastjson.JSONObject;

public interface ConfigValidateService {

    /**
     * 调用 sing-box check 校验配置
     * 校验不通过抛出 ConfigValidationException；可执行文件不可用时仅告警并放行
     */
    void validate(JSONObject document);
}
