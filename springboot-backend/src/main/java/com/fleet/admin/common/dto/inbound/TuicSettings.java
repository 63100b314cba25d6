package com.fleet.admin.common.dto.inbound;

import com.alibaba.fastjson.annotation.JSONField;
import com.fleet.admin.common.enums.InboundProtocol;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
public class TuicSettings extends InboundSettings {

    private List<User> users = new ArrayList<>();

    @JSONField(alternateNames = {"congestion_control"})
    private String congestionControl;

    @JSONField(alternateNames = {"auth_timeout"})
    private String authTimeout;

    @JSONField(alternateNames = {"zero_rtt_handshake"})
    private Boolean zeroRttHandshake;

    private String heartbeat;

    @Override
    public InboundProtocol protocol() {
        return InboundProtocol.TUIC;
    }

    @Override
    public int userCount() {
        return users == null ? 0 : users.size();
    }

    @Data
    public static class User {
        private String name;
        private String uuid;
        private String password;
    }
}
