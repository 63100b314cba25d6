package com.fleet.admin.service;

import com.fleet.admin.common.enums.RelayAuthMode;
import com.fleet.admin.entity.SysConfig;
import com.baomidou.mybatisplus.extension.service.IService;

public interface SysConfigService extends IService<SysConfig> {

    String getValue(String configKey);

    /**
     * 当前中转认证模式，每次生成配置时读取一次
     */
    RelayAuthMode getRelayAuthMode();
}
