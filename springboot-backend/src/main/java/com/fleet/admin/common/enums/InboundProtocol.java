package com.fleet.admin.common.enums;

import com.alibaba.fastjson.JSON;
import com.fleet.admin.common.dto.inbound.AmneziaWgSettings;
import com.fleet.admin.common.dto.inbound.Hysteria2Settings;
import com.fleet.admin.common.dto.inbound.InboundSettings;
import com.fleet.admin.common.dto.inbound.NaiveSettings;
import com.fleet.admin.common.dto.inbound.ShadowsocksSettings;
import com.fleet.admin.common.dto.inbound.TrojanSettings;
import com.fleet.admin.common.dto.inbound.TuicSettings;
import com.fleet.admin.common.dto.inbound.VlessSettings;
import org.apache.commons.lang3.StringUtils;

/**
 * 支持的入站协议，每种协议对应一个 settings 结构
 */
public enum InboundProtocol {

    VLESS("vless", VlessSettings.class),
    HYSTERIA2("hysteria2", Hysteria2Settings.class),
    TROJAN("trojan", TrojanSettings.class),
    TUIC("tuic", TuicSettings.class),
    NAIVE("naive", NaiveSettings.class),
    SHADOWSOCKS("shadowsocks", ShadowsocksSettings.class),
    AMNEZIAWG("amneziawg", AmneziaWgSettings.class);

    private final String value;
    private final Class<? extends InboundSettings> settingsClass;

    InboundProtocol(String value, Class<? extends InboundSettings> settingsClass) {
        this.value = value;
        this.settingsClass = settingsClass;
    }

    public String getValue() {
        return value;
    }

    /**
     * 实例化时需要节点 Reality 密钥的协议
     */
    public boolean usesRealityKeys() {
        return this == VLESS || this == NAIVE;
    }

    /**
     * 解析入站 settings，JSON 非法时抛出 fastjson 的 JSONException
     */
    public InboundSettings parseSettings(String settingsJson) {
        String json = StringUtils.isBlank(settingsJson) ? "{}" : settingsJson;
        return JSON.parseObject(json, settingsClass);
    }

    public static InboundProtocol of(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String normalized = raw.trim().toLowerCase();
        for (InboundProtocol protocol : values()) {
            if (protocol.value.equals(normalized)) {
                return protocol;
            }
        }
        if ("ss".equals(normalized)) {
            return SHADOWSOCKS;
        }
        if ("hy2".equals(normalized)) {
            return HYSTERIA2;
        }
        return null;
    }
}
