package com.fleet.admin.common.dto.inbound;

import com.alibaba.fastjson.annotation.JSONField;
import com.fleet.admin.common.enums.InboundProtocol;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
public class ShadowsocksSettings extends InboundSettings {

    public static final String DEFAULT_METHOD = "chacha20-ietf-poly1305";

    private String method;

    /** 2022 系列加密的服务端密钥，可为空 */
    private String password;

    private List<User> users = new ArrayList<>();

    @Override
    public InboundProtocol protocol() {
        return InboundProtocol.SHADOWSOCKS;
    }

    @Override
    public int userCount() {
        return users == null ? 0 : users.size();
    }

    @Data
    public static class User {
        @JSONField(alternateNames = {"name"})
        private String username;
        private String password;

        public User() {
        }

        public User(String username, String password) {
            this.username = username;
            this.password = password;
        }
    }
}
