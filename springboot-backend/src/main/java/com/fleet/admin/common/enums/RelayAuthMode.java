package com.fleet.admin.common.enums;

import org.apache.commons.lang3.StringUtils;

/**
 * 中转认证模式
 * LEGACY 直接使用 join_token；V1 使用按目标节点派生的哈希；DUAL 迁移期两者并存
 */
public enum RelayAuthMode {

    LEGACY,
    V1,
    DUAL;

    public static RelayAuthMode fromSetting(String raw) {
        if (StringUtils.isBlank(raw)) {
            return DUAL;
        }
        switch (raw.trim().toLowerCase()) {
            case "legacy":
                return LEGACY;
            case "v1":
            case "hashed":
            case "derived":
                return V1;
            default:
                return DUAL;
        }
    }
}
