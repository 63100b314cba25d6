package com.fleet.admin.common.dto.inbound;

import com.alibaba.fastjson.annotation.JSONField;
import com.fleet.admin.common.enums.InboundProtocol;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
public class AmneziaWgSettings extends InboundSettings {

    private List<User> users = new ArrayList<>();

    @JSONField(alternateNames = {"private_key"})
    private String privateKey;

    @JSONField(alternateNames = {"public_key"})
    private String publicKey;

    // 混淆参数
    private Integer jc;
    private Integer jmin;
    private Integer jmax;
    private Integer s1;
    private Integer s2;
    private Long h1;
    private Long h2;
    private Long h3;
    private Long h4;

    @Override
    public InboundProtocol protocol() {
        return InboundProtocol.AMNEZIAWG;
    }

    @Override
    public int userCount() {
        return users == null ? 0 : users.size();
    }

    @Data
    public static class User {
        private String name;
        @JSONField(alternateNames = {"private_key"})
        private String privateKey;
        @JSONField(alternateNames = {"public_key"})
        private String publicKey;
        @JSONField(alternateNames = {"preshared_key"})
        private String presharedKey;
        @JSONField(alternateNames = {"client_ip"})
        private String clientIp;
    }
}
