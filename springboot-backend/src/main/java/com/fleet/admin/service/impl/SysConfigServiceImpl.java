package com.fleet.admin.service.impl;

import com.fleet.admin.common.config.FleetProperties;
import com.fleet.admin.common.enums.RelayAuthMode;
import com.fleet.admin.entity.SysConfig;
import com.fleet.admin.mapper.SysConfigMapper;
import com.fleet.admin.service.SysConfigService;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;

@Service
public class SysConfigServiceImpl extends ServiceImpl<SysConfigMapper, SysConfig> implements SysConfigService {

    public static final String RELAY_AUTH_MODE_KEY = "relay_auth_mode";

    @Resource
    private FleetProperties fleetProperties;

    @Override
    public String getValue(String configKey) {
        SysConfig config = this.getOne(new QueryWrapper<SysConfig>().eq("config_key", configKey), false);
        return config == null ? null : config.getConfigValue();
    }

    @Override
    public RelayAuthMode getRelayAuthMode() {
        String value = getValue(RELAY_AUTH_MODE_KEY);
        if (StringUtils.isBlank(value)) {
            value = fleetProperties.getRelay().getAuthMode();
        }
        return RelayAuthMode.fromSetting(value);
    }
}
